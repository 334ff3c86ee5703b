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

import com.wirelet.exception.RouteConfigurationException;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * An ordered table of {@link Route}s.
 * <p>
 * Routes are tested in registration order and the first one that matches wins, so register more specific routes
 * before overlapping general ones. Registering a route whose pattern equals an existing route's pattern with any
 * method in common fails immediately with {@link RouteConfigurationException}.
 * <p>
 * Matching never blocks: registration publishes a new immutable snapshot of the table, which readers use as-is.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Router<C> {
	@NonNull
	private static final Logger logger = LoggerFactory.getLogger(Router.class);

	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private volatile List<@NonNull Route<C>> routes;

	public Router() {
		this.lock = new ReentrantLock();
		this.routes = List.of();
	}

	/**
	 * Registers a route.
	 *
	 * @param route the route to add
	 * @return this router
	 * @throws RouteConfigurationException if a route with the same pattern and an overlapping method is already registered
	 */
	@NonNull
	public Router<C> add(@NonNull Route<C> route) {
		requireNonNull(route);

		getLock().lock();

		try {
			for (Route<C> existingRoute : this.routes)
				if (existingRoute.getPattern().equals(route.getPattern())
						&& !Collections.disjoint(existingRoute.getHttpMethods(), route.getHttpMethods()))
					throw new RouteConfigurationException(format("Route %s %s conflicts with already-registered route %s %s",
							sortedMethodTokens(route.getHttpMethods()), route.getPattern(),
							sortedMethodTokens(existingRoute.getHttpMethods()), existingRoute.getPattern()));

			List<Route<C>> updatedRoutes = new ArrayList<>(this.routes.size() + 1);
			updatedRoutes.addAll(this.routes);
			updatedRoutes.add(route);

			this.routes = unmodifiableList(updatedRoutes);
		} finally {
			getLock().unlock();
		}

		logger.debug("Registered {}", route);
		return this;
	}

	/**
	 * Registers a handler for a pattern, creating a {@link ParameterizedRoute} if any segment starts with {@code :}
	 * or an {@link ExactRoute} otherwise.
	 *
	 * @param pattern     the path pattern, e.g. {@code /users/:id}
	 * @param handler     the handler
	 * @param httpMethods the accepted methods, or none for {@code GET} only
	 * @return this router
	 * @throws RouteConfigurationException if the route is invalid or conflicts with an existing one
	 */
	@NonNull
	public Router<C> add(@NonNull String pattern,
											 @NonNull Handler<C> handler,
											 @NonNull HttpMethod... httpMethods) {
		requireNonNull(pattern);
		requireNonNull(handler);
		requireNonNull(httpMethods);

		Set<HttpMethod> methods = httpMethods.length == 0 ? EnumSet.of(HttpMethod.GET) : EnumSet.copyOf(Arrays.asList(httpMethods));

		if (RoutePattern.of(pattern).isParameterized())
			return add(ParameterizedRoute.of(pattern, handler, methods));

		return add(ExactRoute.of(pattern, handler, methods));
	}

	/**
	 * Finds the first route matching a request.
	 *
	 * @param path        the raw request path, possibly with a query and trailing slash
	 * @param methodToken the request method as sent on the wire, e.g. {@code GET}
	 * @return the match, or {@link Optional#empty()} if no route matches or the method is not a standard one
	 */
	@NonNull
	public Optional<RouteMatch<C>> match(@NonNull String path,
																			 @NonNull String methodToken) {
		requireNonNull(path);
		requireNonNull(methodToken);

		HttpMethod httpMethod = HttpMethod.fromToken(methodToken).orElse(null);

		if (httpMethod == null)
			return Optional.empty();

		return match(path, httpMethod);
	}

	@NonNull
	public Optional<RouteMatch<C>> match(@NonNull String path,
																			 @NonNull HttpMethod httpMethod) {
		requireNonNull(path);
		requireNonNull(httpMethod);

		String normalizedPath = RoutePattern.normalizePath(path);

		for (Route<C> route : this.routes) {
			Optional<Map<String, String>> pathParameters = route.match(normalizedPath, httpMethod);

			if (pathParameters.isPresent())
				return Optional.of(new RouteMatch<>(route, pathParameters.get()));
		}

		return Optional.empty();
	}

	/**
	 * The registered routes in registration order.
	 *
	 * @return an immutable snapshot of the route table
	 */
	@NonNull
	public List<@NonNull Route<C>> getRoutes() {
		return this.routes;
	}

	/**
	 * Converts method tokens such as {@code "GET"} into {@link HttpMethod}s.
	 *
	 * @param methodTokens the tokens, which are case-sensitive
	 * @return the corresponding methods
	 * @throws RouteConfigurationException if a token is not a standard HTTP method
	 */
	@NonNull
	public static Set<@NonNull HttpMethod> httpMethodsFromTokens(@NonNull String... methodTokens) {
		requireNonNull(methodTokens);

		Set<HttpMethod> httpMethods = EnumSet.noneOf(HttpMethod.class);

		for (String methodToken : methodTokens)
			httpMethods.add(HttpMethod.fromToken(methodToken)
					.orElseThrow(() -> new RouteConfigurationException(format("'%s' is not a supported HTTP method", methodToken))));

		return Collections.unmodifiableSet(httpMethods);
	}

	@NonNull
	static Set<@NonNull HttpMethod> validatedHttpMethods(@NonNull Set<HttpMethod> httpMethods,
																											 @NonNull String pattern) {
		requireNonNull(httpMethods);
		requireNonNull(pattern);

		if (httpMethods.isEmpty())
			throw new RouteConfigurationException(format("Route '%s' must accept at least one HTTP method", pattern));

		for (HttpMethod httpMethod : httpMethods)
			if (httpMethod == null)
				throw new RouteConfigurationException(format("Route '%s' has a null HTTP method", pattern));

		return Collections.unmodifiableSet(EnumSet.copyOf(httpMethods));
	}

	@NonNull
	private static String sortedMethodTokens(@NonNull Set<HttpMethod> httpMethods) {
		return httpMethods.stream()
				.map(HttpMethod::name)
				.sorted()
				.collect(Collectors.joining(",", "[", "]"));
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@Override
	public String toString() {
		return format("%s{routes=%s}", getClass().getSimpleName(), getRoutes());
	}
}
