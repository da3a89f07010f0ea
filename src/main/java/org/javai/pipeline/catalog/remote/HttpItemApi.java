package org.javai.pipeline.catalog.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link ItemApi} over HTTP against a TMDB-style JSON API.
 *
 * <p>Configuration is provided via system properties with environment variable fallbacks:
 * <ul>
 *   <li>{@code catalog.api.base-url} / {@code CATALOG_API_BASE_URL}, defaults to {@value #DEFAULT_BASE_URL}</li>
 *   <li>{@code catalog.api.key} / {@code CATALOG_API_KEY} (required)</li>
 * </ul>
 *
 * <p>Any non-2xx response is an {@link IOException}; a body that cannot be decoded surfaces
 * as Jackson's {@link com.fasterxml.jackson.core.JsonProcessingException}.
 */
public class HttpItemApi implements ItemApi {

	static final String DEFAULT_BASE_URL = "https://api.themoviedb.org/3/";
	private static final Duration TIMEOUT = Duration.ofSeconds(30);

	private static final Logger logger = LogManager.getLogger(HttpItemApi.class);

	private final URI baseUri;
	private final String apiKey;
	private final HttpClient httpClient;
	private final ObjectMapper objectMapper;

	/**
	 * Creates an HttpItemApi using configuration from system properties or environment variables.
	 *
	 * @throws IllegalStateException if the API key is missing
	 */
	public static HttpItemApi fromEnvironment() {
		String baseUrl = resolveConfig("catalog.api.base-url", "CATALOG_API_BASE_URL");
		String apiKey = resolveConfig("catalog.api.key", "CATALOG_API_KEY");
		if (apiKey == null) {
			throw new IllegalStateException("Missing API key: set catalog.api.key or CATALOG_API_KEY");
		}
		return new HttpItemApi(baseUrl != null ? baseUrl : DEFAULT_BASE_URL, apiKey);
	}

	public HttpItemApi(String baseUrl, String apiKey) {
		this(baseUrl, apiKey, HttpClient.newBuilder()
				.connectTimeout(TIMEOUT)
				.build(), new ObjectMapper());
	}

	HttpItemApi(String baseUrl, String apiKey, HttpClient httpClient, ObjectMapper objectMapper) {
		Objects.requireNonNull(baseUrl, "baseUrl must not be null");
		this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
		this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	@Override
	public ItemPage popular(int page) throws IOException {
		return get("movie/popular", "page=" + page, ItemPage.class);
	}

	@Override
	public ItemRecord details(int itemId) throws IOException {
		return get("movie/" + itemId, "", ItemRecord.class);
	}

	@Override
	public ItemPage search(String query, int page) throws IOException {
		return get("search/movie", "query=" + encode(query) + "&page=" + page, ItemPage.class);
	}

	private <T> T get(String path, String query, Class<T> type) throws IOException {
		String auth = "api_key=" + encode(apiKey);
		URI uri = baseUri.resolve(path + "?" + (query.isEmpty() ? auth : query + "&" + auth));

		HttpRequest request = HttpRequest.newBuilder()
				.uri(uri)
				.header("Accept", "application/json")
				.timeout(TIMEOUT)
				.GET()
				.build();

		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while calling " + uri.getPath());
		}

		logger.debug("GET {} -> {}", uri.getPath(), response.statusCode());
		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw new IOException("HTTP " + response.statusCode() + " from " + uri.getPath());
		}
		return objectMapper.readValue(response.body(), type);
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	private static String resolveConfig(String propertyName, String envName) {
		String value = System.getProperty(propertyName);
		if (value == null || value.isBlank()) {
			value = System.getenv(envName);
		}
		return value == null || value.isBlank() ? null : value;
	}
}
