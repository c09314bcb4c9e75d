package org.springaicommunity.commitwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * {@link AnalysisClient} using the JDK {@link HttpClient}. Issues exactly one request
 * per call; there is no retry.
 */
public class HttpAnalysisClient implements AnalysisClient {

	private static final Logger logger = LoggerFactory.getLogger(HttpAnalysisClient.class);

	private final HttpClient httpClient;

	private final URI endpoint;

	private final String apiKey;

	private final Duration requestTimeout;

	public HttpAnalysisClient(String baseUrl, String endpointPath, String apiKey, Duration connectTimeout,
			Duration requestTimeout) {
		this.endpoint = URI.create(baseUrl + endpointPath);
		this.apiKey = apiKey;
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String postChatCompletion(String jsonBody) {
		logger.debug("POST {} ({} bytes)", endpoint, jsonBody.length());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(endpoint)
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + apiKey)
			.header("Content-Type", "application/json")
			.header("User-Agent", "commit-watch")
			.POST(HttpRequest.BodyPublishers.ofString(jsonBody))
			.build();

		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			int statusCode = response.statusCode();
			logger.debug("POST {} returned {} in {}ms", endpoint, statusCode, System.currentTimeMillis() - start);
			if (statusCode != 200) {
				throw new AnalysisServiceException(statusCode, response.body());
			}
			return response.body();
		}
		catch (HttpTimeoutException e) {
			throw new AnalysisServiceException("Analysis request timed out after " + requestTimeout.toSeconds() + "s",
					e);
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new AnalysisServiceException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new AnalysisServiceException("HTTP request interrupted", e);
		}
	}

}
