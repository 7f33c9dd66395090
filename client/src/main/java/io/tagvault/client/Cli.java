// file: client/src/main/java/io/tagvault/client/Cli.java
package io.tagvault.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for talking to a running tagvault node over HTTP.
 *
 * Usage:
 *   tagvault-cli [--base-url http://host:port] <operation> [field=value ...]
 *   tagvault-cli [--base-url http://host:port] sync
 *   tagvault-cli [--base-url http://host:port] status
 *   tagvault-cli [--base-url http://host:port] health
 *
 * Examples:
 *   tagvault-cli createTag name=Work color=#3b82f6
 *   tagvault-cli registerPage url=https://example.com title=Example
 *   tagvault-cli getTaggedPages tagId=4f1c...
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing operation");
            }

            Cli cli = new Cli(parsed.getKey());
            String cmd = rest[0];
            switch (cmd) {
                case "sync" -> cli.send("POST", "/admin/sync", null);
                case "status" -> cli.send("GET", "/admin/sync", null);
                case "health" -> cli.send("GET", "/admin/health", null);
                default -> {
                    ObjectNode body = buildRpcBody(cmd, Arrays.asList(rest).subList(1, rest.length));
                    cli.send("POST", "/rpc", JSON.writeValueAsString(body));
                }
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /**
     * {"operation": op, "payload": {field: value, ...}} from "field=value" arguments.
     * Only the first '=' separates; the value may contain more.
     */
    static ObjectNode buildRpcBody(String operation, List<String> fields) {
        ObjectNode root = JSON.createObjectNode();
        root.put("operation", operation);
        ObjectNode payload = root.putObject("payload");
        for (String f : fields) {
            int eq = f.indexOf('=');
            if (eq <= 0) {
                throw new CliException("expected field=value, got: " + f);
            }
            payload.put(f.substring(0, eq), f.substring(eq + 1));
        }
        return root;
    }

    private void send(String method, String path, String body) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(baseUrl + path));
        if (body == null) {
            b.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            b.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        }

        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        System.out.println(pretty(resp.body()));
        if (resp.statusCode() != 200) {
            throw new CliException(method + " " + path + " failed (" + resp.statusCode() + ")");
        }
    }

    private static String pretty(String body) {
        try {
            JsonNode node = JSON.readTree(body);
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  tagvault-cli [--base-url http://host:port] <operation> [field=value ...]
                  tagvault-cli [--base-url http://host:port] sync
                  tagvault-cli [--base-url http://host:port] status
                  tagvault-cli [--base-url http://host:port] health
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
