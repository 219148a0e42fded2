// file: client/src/main/java/io/chesslink/client/Cli.java
package io.chesslink.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * Small CLI for inspecting a running document store over HTTP.
 *
 * Usage:
 *   chesslink-cli [--base-url http://host:port] get <sessionId>
 *   chesslink-cli [--base-url http://host:port] health
 *
 * Examples:
 *   chesslink-cli get a1b2c3d4
 *   chesslink-cli --base-url http://localhost:9000 health
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8090";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient http;
    private final String baseUrl;

    Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            Cli cli = new Cli(parsed.getKey());
            switch (rest[0]) {
                case "get" -> {
                    if (rest.length != 2) {
                        usageAndExit("get requires <sessionId>");
                    }
                    System.out.println(cli.get(rest[1]));
                }
                case "health" -> System.out.println(cli.health());
                default -> usageAndExit("unknown command: " + rest[0]);
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
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(args[1], rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** Pretty-printed saved game, or "(not found)". */
    String get(String sessionId) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/games/" + sessionId))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404) {
            return "(not found)";
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET failed (" + resp.statusCode() + "): " + resp.body());
        }
        JsonNode body = MAPPER.readTree(resp.body());
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(body);
    }

    String health() throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/admin/health"))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("store unhealthy (" + resp.statusCode() + "): " + resp.body());
        }
        return "OK";
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  chesslink-cli [--base-url http://host:port] get <sessionId>
                  chesslink-cli [--base-url http://host:port] health
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
