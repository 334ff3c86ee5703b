/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.wirelet;

import org.jspecify.annotations.NonNull;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * HTTP status codes paired with their standard reason phrases.
 * <p>
 * The reason phrase is what Wirelet writes on the response status line and what it uses as the body of
 * default error responses, e.g. {@code HTTP/1.1 404 Not Found}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum StatusCode {
	HTTP_100(100, "Continue"),
	HTTP_101(101, "Switching Protocols"),
	HTTP_200(200, "OK"),
	HTTP_201(201, "Created"),
	HTTP_202(202, "Accepted"),
	HTTP_203(203, "Non-Authoritative Information"),
	/**
	 * Success with an intentionally empty body.
	 */
	HTTP_204(204, "No Content"),
	HTTP_205(205, "Reset Content"),
	HTTP_206(206, "Partial Content"),
	HTTP_300(300, "Multiple Choices"),
	/**
	 * The default status of {@link Response#redirect(String)}.
	 */
	HTTP_301(301, "Moved Permanently"),
	HTTP_302(302, "Found"),
	HTTP_303(303, "See Other"),
	HTTP_304(304, "Not Modified"),
	HTTP_307(307, "Temporary Redirect"),
	HTTP_308(308, "Permanent Redirect"),
	/**
	 * Sent when the request line or header block cannot be parsed.
	 */
	HTTP_400(400, "Bad Request"),
	/**
	 * Sent by {@link Middleware#basicAuth(String, String)} when credentials are missing or wrong.
	 */
	HTTP_401(401, "Unauthorized"),
	HTTP_402(402, "Payment Required"),
	HTTP_403(403, "Forbidden"),
	/**
	 * Sent when no route matches, or when a static file does not exist.
	 */
	HTTP_404(404, "Not Found"),
	HTTP_405(405, "Method Not Allowed"),
	HTTP_406(406, "Not Acceptable"),
	HTTP_408(408, "Request Timeout"),
	HTTP_409(409, "Conflict"),
	HTTP_410(410, "Gone"),
	HTTP_411(411, "Length Required"),
	HTTP_412(412, "Precondition Failed"),
	/**
	 * Sent when a request declares a body larger than the configured maximum.
	 */
	HTTP_413(413, "Content Too Large"),
	HTTP_414(414, "URI Too Long"),
	HTTP_415(415, "Unsupported Media Type"),
	HTTP_416(416, "Range Not Satisfiable"),
	HTTP_417(417, "Expectation Failed"),
	HTTP_418(418, "I'm a Teapot"),
	HTTP_422(422, "Unprocessable Content"),
	HTTP_426(426, "Upgrade Required"),
	HTTP_428(428, "Precondition Required"),
	HTTP_429(429, "Too Many Requests"),
	/**
	 * Sent when the request header block exceeds the configured maximum size.
	 */
	HTTP_431(431, "Request Header Fields Too Large"),
	HTTP_451(451, "Unavailable For Legal Reasons"),
	/**
	 * Sent for any failure that is not an {@link com.wirelet.exception.HttpException}.
	 */
	HTTP_500(500, "Internal Server Error"),
	HTTP_501(501, "Not Implemented"),
	HTTP_502(502, "Bad Gateway"),
	HTTP_503(503, "Service Unavailable"),
	HTTP_504(504, "Gateway Timeout"),
	HTTP_505(505, "HTTP Version Not Supported"),
	HTTP_507(507, "Insufficient Storage"),
	HTTP_511(511, "Network Authentication Required");

	@NonNull
	private static final Map<Integer, StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	/**
	 * Looks up the enum value for a numeric status code.
	 *
	 * @param statusCode the numeric HTTP status code
	 * @return the matching value, or {@link Optional#empty()} if Wirelet does not know the code
	 */
	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	/**
	 * Is this an error status (4xx or 5xx)?
	 *
	 * @return {@code true} for client and server error codes
	 */
	@NonNull
	public Boolean isError() {
		return getStatusCode() >= 400;
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * The English reason phrase, e.g. {@code Not Found} for {@link #HTTP_404}.
	 *
	 * @return the reason phrase
	 */
	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
