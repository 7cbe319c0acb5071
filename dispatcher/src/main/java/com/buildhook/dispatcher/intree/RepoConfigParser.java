package com.buildhook.dispatcher.intree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.springframework.stereotype.Component;

/**
 * Parses .taskcluster.yml text into a Jackson tree.
 */
@Component
public class RepoConfigParser {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    /**
     * @return the document root; {@link MissingNode} for an empty file
     * @throws ConfigException PARSE with the parser's message (line/column included)
     */
    public JsonNode parse(String text) {
        try {
            JsonNode root = yaml.readTree(text);
            return root == null ? MissingNode.getInstance() : root;
        } catch (JsonProcessingException e) {
            throw new ConfigException(ConfigException.Kind.PARSE, e.getMessage(), e);
        }
    }
}
