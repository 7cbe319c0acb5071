package com.buildhook.dispatcher.intree;

import com.buildhook.dispatcher.event.JobEvent;

import java.util.Map;

/**
 * Input to {@link ConfigCompiler#compile}.
 *
 * @param config       raw .taskcluster.yml text
 * @param organization decoded organization name
 * @param repository   decoded repository name
 * @param event        the webhook event the graph is compiled for
 * @param schemas      config schema URL per config version, quoted in errors
 */
public record CompileRequest(
        String              config,
        String              organization,
        String              repository,
        JobEvent            event,
        Map<Integer, String> schemas
) {}
