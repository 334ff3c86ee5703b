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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A cookie to be sent to the client as a {@code Set-Cookie} response header.
 * <p>
 * See <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Set-Cookie">https://developer.mozilla.org/en-US/docs/Web/HTTP/Headers/Set-Cookie</a> for details.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ResponseCookie {
	@NonNull
	private final String name;
	@NonNull
	private final String value;
	@Nullable
	private final Duration maxAge;
	@Nullable
	private final Instant expires;
	@Nullable
	private final String domain;
	@Nullable
	private final String path;
	@NonNull
	private final Boolean secure;
	@NonNull
	private final Boolean httpOnly;
	@Nullable
	private final SameSite sameSite;

	/**
	 * Acquires a builder for {@link ResponseCookie} instances.
	 *
	 * @param name  the cookie name
	 * @param value the cookie value
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String name,
														 @NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);

		return new Builder(name, value);
	}

	private ResponseCookie(@NonNull Builder builder) {
		requireNonNull(builder);

		this.name = builder.name;
		this.value = builder.value;
		this.maxAge = builder.maxAge;
		this.expires = builder.expires;
		this.domain = builder.domain;
		this.path = builder.path;
		this.secure = builder.secure == null ? false : builder.secure;
		this.httpOnly = builder.httpOnly == null ? false : builder.httpOnly;
		this.sameSite = builder.sameSite;

		validateCookieName(getName());
		validateAttributeValue("value", getValue());
		validateAttributeValue("domain", getDomain().orElse(null));
		validateAttributeValue("path", getPath().orElse(null));
	}

	/**
	 * Generates the {@code Set-Cookie} header value for this cookie, e.g. {@code session=abc; Path=/; HttpOnly}.
	 *
	 * @return this cookie in {@code Set-Cookie} header format
	 */
	@NonNull
	public String toSetCookieHeaderRepresentation() {
		List<String> components = new ArrayList<>(9);

		components.add(format("%s=%s", getName(), getValue()));

		if (getPath().isPresent())
			components.add(format("Path=%s", getPath().get()));

		if (getDomain().isPresent())
			components.add(format("Domain=%s", getDomain().get()));

		if (getMaxAge().isPresent())
			components.add(format("Max-Age=%d", Math.max(0, getMaxAge().get().toSeconds())));

		if (getExpires().isPresent())
			components.add(format("Expires=%s", Utilities.formatHttpDate(getExpires().get())));

		if (getSecure())
			components.add("Secure");

		if (getHttpOnly())
			components.add("HttpOnly");

		if (getSameSite().isPresent())
			components.add(format("SameSite=%s", getSameSite().get().getHeaderRepresentation()));

		return String.join("; ", components);
	}

	private static void validateCookieName(@NonNull String name) {
		requireNonNull(name);

		if (name.isEmpty())
			throw new IllegalArgumentException("Cookie name must not be empty");

		for (int i = 0; i < name.length(); ++i) {
			char c = name.charAt(i);

			if (c <= 0x20 || c >= 0x7F || "()<>@,;:\\\"/[]?={}".indexOf(c) != -1)
				throw new IllegalArgumentException(format("Illegal cookie name '%s'. Offending character: '%s'", name, Utilities.printableChar(c)));
		}
	}

	private static void validateAttributeValue(@NonNull String attributeName,
																						 @Nullable String attributeValue) {
		requireNonNull(attributeName);

		if (attributeValue == null)
			return;

		for (int i = 0; i < attributeValue.length(); ++i) {
			char c = attributeValue.charAt(i);

			if (c == ';' || c == '\r' || c == '\n' || c < 0x20 || c == 0x7F)
				throw new IllegalArgumentException(format("Illegal cookie %s '%s'. Offending character: '%s'",
						attributeName, Utilities.printableString(attributeValue), Utilities.printableChar(c)));
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getValue(), getMaxAge(), getExpires(), getDomain(), getPath(), getSecure(), getHttpOnly(), getSameSite());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResponseCookie responseCookie))
			return false;

		return Objects.equals(getName(), responseCookie.getName())
				&& Objects.equals(getValue(), responseCookie.getValue())
				&& Objects.equals(getMaxAge(), responseCookie.getMaxAge())
				&& Objects.equals(getExpires(), responseCookie.getExpires())
				&& Objects.equals(getDomain(), responseCookie.getDomain())
				&& Objects.equals(getPath(), responseCookie.getPath())
				&& Objects.equals(getSecure(), responseCookie.getSecure())
				&& Objects.equals(getHttpOnly(), responseCookie.getHttpOnly())
				&& Objects.equals(getSameSite(), responseCookie.getSameSite());
	}

	@Override
	public String toString() {
		return toSetCookieHeaderRepresentation();
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public String getValue() {
		return this.value;
	}

	@NonNull
	public Optional<Duration> getMaxAge() {
		return Optional.ofNullable(this.maxAge);
	}

	@NonNull
	public Optional<Instant> getExpires() {
		return Optional.ofNullable(this.expires);
	}

	@NonNull
	public Optional<String> getDomain() {
		return Optional.ofNullable(this.domain);
	}

	@NonNull
	public Optional<String> getPath() {
		return Optional.ofNullable(this.path);
	}

	@NonNull
	public Boolean getSecure() {
		return this.secure;
	}

	@NonNull
	public Boolean getHttpOnly() {
		return this.httpOnly;
	}

	@NonNull
	public Optional<SameSite> getSameSite() {
		return Optional.ofNullable(this.sameSite);
	}

	/**
	 * Values for the {@code SameSite} cookie attribute.
	 */
	public enum SameSite {
		STRICT("Strict"),
		LAX("Lax"),
		NONE("None");

		@NonNull
		private final String headerRepresentation;

		SameSite(@NonNull String headerRepresentation) {
			requireNonNull(headerRepresentation);
			this.headerRepresentation = headerRepresentation;
		}

		@NonNull
		public String getHeaderRepresentation() {
			return this.headerRepresentation;
		}
	}

	/**
	 * Builder used to construct instances of {@link ResponseCookie} via {@link ResponseCookie#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String name;
		@NonNull
		private final String value;
		@Nullable
		private Duration maxAge;
		@Nullable
		private Instant expires;
		@Nullable
		private String domain;
		@Nullable
		private String path;
		@Nullable
		private Boolean secure;
		@Nullable
		private Boolean httpOnly;
		@Nullable
		private SameSite sameSite;

		private Builder(@NonNull String name,
										@NonNull String value) {
			this.name = name;
			this.value = value;
		}

		@NonNull
		public Builder maxAge(@Nullable Duration maxAge) {
			this.maxAge = maxAge;
			return this;
		}

		@NonNull
		public Builder expires(@Nullable Instant expires) {
			this.expires = expires;
			return this;
		}

		@NonNull
		public Builder domain(@Nullable String domain) {
			this.domain = domain;
			return this;
		}

		@NonNull
		public Builder path(@Nullable String path) {
			this.path = path;
			return this;
		}

		@NonNull
		public Builder secure(@Nullable Boolean secure) {
			this.secure = secure;
			return this;
		}

		@NonNull
		public Builder httpOnly(@Nullable Boolean httpOnly) {
			this.httpOnly = httpOnly;
			return this;
		}

		@NonNull
		public Builder sameSite(@Nullable SameSite sameSite) {
			this.sameSite = sameSite;
			return this;
		}

		@NonNull
		public ResponseCookie build() {
			return new ResponseCookie(this);
		}
	}
}
