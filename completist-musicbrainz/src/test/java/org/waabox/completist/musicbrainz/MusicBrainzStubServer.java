package org.waabox.completist.musicbrainz;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * A local stand-in for MusicBrainz and the Cover Art Archive.
 *
 * <p>Routes match a path and, optionally, a set of query parameters; the
 * first route registered that matches wins. Requests matching no route
 * answer 404.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class MusicBrainzStubServer implements AutoCloseable {

  /** The underlying server. */
  private final HttpServer server;

  /** The routes, in registration order. */
  private final List<Route> routes = new CopyOnWriteArrayList<>();

  /** Every request received, in order. */
  private final List<Request> requests = new CopyOnWriteArrayList<>();

  /**
   * Starts a new server on an ephemeral port.
   *
   * @throws IOException if the server cannot bind
   */
  MusicBrainzStubServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/", this::handle);
    server.start();
  }

  /**
   * Answers a path with a JSON document, whatever the query.
   *
   * @param path the path, never null
   * @param json the body, never null
   * @return this server for chaining
   */
  MusicBrainzStubServer serve(final String path, final String json) {
    return serve(path, Map.of(), 200, json);
  }

  /**
   * Answers a path whose query contains the given parameters.
   *
   * @param path   the path, never null
   * @param when   the parameters the query must contain, never null
   * @param status the status code
   * @param body   the body, may be empty
   * @return this server for chaining
   */
  MusicBrainzStubServer serve(final String path,
      final Map<String, String> when, final int status, final String body) {
    routes.add(new Route(path, when, status, body));
    return this;
  }

  /**
   * Returns the base URL of the web service.
   *
   * @return the base URL, never null
   */
  String baseUrl() {
    return root() + "/ws/2";
  }

  /**
   * Returns the base URL of the cover art archive.
   *
   * @return the base URL, never null
   */
  String coverArtUrl() {
    return root() + "/caa";
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

  private String root() {
    return "http://localhost:" + server.getAddress().getPort();
  }

  private void handle(final HttpExchange exchange) throws IOException {
    final String path = exchange.getRequestURI().getPath();
    final Map<String, String> params = decode(
        exchange.getRequestURI().getRawQuery());
    requests.add(new Request(exchange.getRequestMethod(), path, params,
        exchange.getRequestHeaders().getFirst("User-Agent")));

    Route match = null;
    for (final Route route : routes) {
      if (route.path().equals(path)
          && params.entrySet().containsAll(route.when().entrySet())) {
        match = route;
        break;
      }
    }
    final int status = match == null ? 404 : match.status();
    final byte[] body = (match == null
        ? "{\"error\":\"Not Found\"}"
        : match.body()).getBytes(StandardCharsets.UTF_8);

    if (body.length == 0 || "HEAD".equals(exchange.getRequestMethod())) {
      exchange.sendResponseHeaders(status, -1);
      exchange.close();
      return;
    }
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

  /** A canned answer. */
  private record Route(String path, Map<String, String> when, int status,
      String body) {
  }

  /** A recorded request. */
  record Request(String method, String path, Map<String, String> params,
      String userAgent) {
  }
}
