/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.core.ApiAuthorization;
import com.intuitivedesigns.routerkernel.core.ClientLabel;
import com.intuitivedesigns.routerkernel.robot.RobotRouterParams;
import com.intuitivedesigns.routerkernel.robot.RobotRouterPlugin;
import com.intuitivedesigns.routerkernel.spi.ClientLabelDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the YAML files the kernel is configured from.
 *
 * <ul>
 *   <li>Authorization file: a multi-document YAML stream, one {@code ApiAuthorization} mapping per
 *       document ({@code router}, {@code router_params}, {@code users}, {@code groups}).</li>
 *   <li>Robot defaults: a single {@code router_params} mapping applied to robot records without params.</li>
 *   <li>Client labels: a mapping of client id to a list of {@code {name, owner}} entries.</li>
 * </ul>
 */
public final class AuthorizationFileLoader {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationFileLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private AuthorizationFileLoader() {}

    public static List<ApiAuthorization> load(Path path) throws ConfigurationException {
        Objects.requireNonNull(path, "path");
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<ApiAuthorization> records = parse(in, path.toString());
            log.info("Read {} authorization records from {}", records.size(), path);
            return records;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read authorization file " + path + ": " + e.getMessage(), e);
        }
    }

    public static List<ApiAuthorization> parse(String yaml) throws ConfigurationException {
        return parse(new StringReader(yaml), "<inline>");
    }

    static List<ApiAuthorization> parse(Reader in, String source) throws ConfigurationException {
        final List<ApiAuthorization> records = new ArrayList<>();
        int document = 0;
        try (MappingIterator<JsonNode> docs = YAML.readerFor(JsonNode.class).readValues(in)) {
            while (docs.hasNextValue()) {
                final JsonNode node = docs.nextValue();
                document++;
                if (node == null || node.isNull() || node.isMissingNode() || (node.isObject() && node.isEmpty())) {
                    continue;
                }
                if (!node.isObject()) {
                    throw new ConfigurationException(source + " document " + document + " is not a mapping");
                }
                records.add(toRecord(node, source, document));
            }
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    source + " document " + (document + 1) + " is invalid: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + source + ": " + e.getMessage(), e);
        }
        return records;
    }

    private static ApiAuthorization toRecord(JsonNode node, String source, int document) throws ConfigurationException {
        try {
            return YAML.treeToValue(node, ApiAuthorization.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    source + " document " + document + " is invalid: " + e.getOriginalMessage(), e);
        }
    }

    public static RobotRouterParams loadRobotDefaults(Path path) throws ConfigurationException {
        final JsonNode tree = readTree(path);
        return new RobotRouterPlugin().parseParams(tree);
    }

    /**
     * Builds a fixed label directory from a YAML mapping {@code clientId -> [{name, owner}, ...]}.
     */
    public static ClientLabelDirectory loadClientLabels(Path path) throws ConfigurationException {
        final JsonNode tree = readTree(path);
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            return ClientLabelDirectory.EMPTY;
        }
        if (!tree.isObject()) {
            throw new ConfigurationException("Client labels file " + path + " must be a mapping");
        }

        final Map<String, Set<ClientLabel>> labels = new HashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> it = ((ObjectNode) tree).fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> e = it.next();
            final Set<ClientLabel> set = new HashSet<>();
            for (JsonNode label : e.getValue()) {
                final String name = label.path("name").asText("");
                if (name.isBlank()) {
                    throw new ConfigurationException("Label without name for client " + e.getKey() + " in " + path);
                }
                set.add(new ClientLabel(name, label.path("owner").asText("")));
            }
            labels.put(e.getKey(), Set.copyOf(set));
        }
        log.info("Read labels for {} clients from {}", labels.size(), path);
        final Map<String, Set<ClientLabel>> frozen = Map.copyOf(labels);
        return clientId -> frozen.getOrDefault(clientId, Set.of());
    }

    private static JsonNode readTree(Path path) throws ConfigurationException {
        Objects.requireNonNull(path, "path");
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return YAML.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }
}
