// Copyright (c) 2024 The Event Hubs AMQP Java Client Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.eventhubs.client.amqp.impl;

import com.eventhubs.client.amqp.AmqpException;
import com.eventhubs.client.amqp.auth.Token;
import com.eventhubs.client.amqp.auth.TokenRequester;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * {@link TokenRequester} that signs shared access signature tokens with a shared access key.
 *
 * <p>Token format: <code>SharedAccessSignature sr=&lt;resource&gt;&amp;sig=&lt;signature&gt;
 * &amp;se=&lt;expiry&gt;&amp;skn=&lt;key name&gt;</code>, the signature is the HMAC-SHA256 of the
 * encoded resource and the expiry (epoch seconds), separated by a new line.
 */
public class SharedAccessSignatureTokenRequester implements TokenRequester {

  static final Duration DEFAULT_VALIDITY = Duration.ofHours(1);
  static final String TOKEN_TYPE = "servicebus.windows.net:sastoken";

  private static final String ALGORITHM = "HmacSHA256";

  private final String keyName;
  private final byte[] key;
  private final Duration validity;
  private final Clock clock;

  public SharedAccessSignatureTokenRequester(String keyName, String key) {
    this(keyName, key, DEFAULT_VALIDITY);
  }

  public SharedAccessSignatureTokenRequester(String keyName, String key, Duration validity) {
    this(keyName, key, validity, Clock.systemUTC());
  }

  SharedAccessSignatureTokenRequester(String keyName, String key, Duration validity, Clock clock) {
    this.keyName = Assert.notBlank(keyName, "Shared access key name cannot be null or blank");
    this.key =
        Assert.notBlank(key, "Shared access key cannot be null or blank")
            .getBytes(StandardCharsets.UTF_8);
    Assert.notNull(validity, "Validity cannot be null");
    if (validity.isZero() || validity.isNegative()) {
      throw new IllegalArgumentException("Validity must be positive: " + validity);
    }
    this.validity = validity;
    this.clock = clock;
  }

  @Override
  public Token request(String audience, List<String> claims) {
    Assert.notBlank(audience, "Audience cannot be null or blank");
    Instant expiration = this.clock.instant().plus(this.validity);
    long expiry = expiration.getEpochSecond();
    String resource = UriUtils.encodeNonUnreserved(audience.toLowerCase(Locale.ROOT));
    String signature = sign(resource + "\n" + expiry);
    String value =
        String.format(
            "SharedAccessSignature sr=%s&sig=%s&se=%d&skn=%s",
            resource,
            UriUtils.encodeNonUnreserved(signature),
            expiry,
            UriUtils.encodeNonUnreserved(this.keyName));
    return new SharedAccessSignatureToken(value, Instant.ofEpochSecond(expiry));
  }

  private String sign(String toSign) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(this.key, ALGORITHM));
      byte[] signature = mac.doFinal(toSign.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(signature);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new AmqpException.AmqpSecurityException("Error while signing token", e);
    }
  }

  private static final class SharedAccessSignatureToken implements Token {

    private final String value;
    private final Instant expirationTime;

    private SharedAccessSignatureToken(String value, Instant expirationTime) {
      this.value = value;
      this.expirationTime = expirationTime;
    }

    @Override
    public String value() {
      return this.value;
    }

    @Override
    public Instant expirationTime() {
      return this.expirationTime;
    }

    @Override
    public String type() {
      return TOKEN_TYPE;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      SharedAccessSignatureToken that = (SharedAccessSignatureToken) o;
      return value.equals(that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(value);
    }

    @Override
    public String toString() {
      return "SharedAccessSignatureToken{expirationTime=" + expirationTime + "}";
    }
  }
}
