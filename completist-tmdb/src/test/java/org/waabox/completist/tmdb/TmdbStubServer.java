package org.waabox.completist.tmdb;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * A local stand-in for the TMDB API serving one JSON document per path and
 * recording the decoded query of every request.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class TmdbStubServer implements AutoCloseable {

  /** The underlying server. */
  private final HttpServer server;

  /** The documents, by path. */
  private final Map<String, String> documents = new ConcurrentHashMap<>();

  /** The decoded query parameters of each request, in arrival order. */
  private final List<Request> requests = new CopyOnWriteArrayList<>();

  /**
   * Starts a new server on an ephemeral port.
   *
   * @throws IOException if the server cannot bind
   */
  TmdbStubServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/", this::handle);
    server.start();
  }

  /**
   * Serves a document for a path.
   *
   * @param path the path, never null
   * @param json the JSON body, never null
   * @return this server for chaining
   */
  TmdbStubServer serve(final String path, final String json) {
    documents.put(path, json);
    return this;
  }

  /**
   * Returns the base URL of this server.
   *
   * @return the base URL, never null
   */
  String baseUrl() {
    return "http://localhost:" + server.getAddress().getPort() + "/3";
  }

  /**
   * Returns the requests received so far.
   *
   * @return the requests, never null
   */
  List<Request> requests() {
    return List.copyOf(requests);
  }

  @Override
  public void close() {
    server.stop(0);
  }

  private void handle(final HttpExchange exchange) throws IOException {
    final String path = exchange.getRequestURI().getPath()
        .replaceFirst("^/3", "");
    requests.add(new Request(path,
        decode(exchange.getRequestURI().getRawQuery())));

    final String json = documents.get(path);
    final int status = json == null ? 404 : 200;
    final byte[] body = (json == null
        ? "{\"status_code\":34,\"status_message\":\"The resource you"
            + " requested could not be found.\"}"
        : json).getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  private static Map<String, String> decode(final String rawQuery) {
    final Map<String, String> params = new LinkedHashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return params;
    }
    for (final String pair : rawQuery.split("&")) {
      final int eq = pair.indexOf('=');
      final String name = eq < 0 ? pair : pair.substring(0, eq);
      final String value = eq < 0 ? "" : pair.substring(eq + 1);
      params.put(URLDecoder.decode(name, StandardCharsets.UTF_8),
          URLDecoder.decode(value, StandardCharsets.UTF_8));
    }
    return params;
  }

  /** A recorded request. */
  record Request(String path, Map<String, String> params) {
  }
}
