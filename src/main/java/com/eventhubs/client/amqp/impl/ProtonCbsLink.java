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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.eventhubs.client.amqp.AmqpException;
import com.eventhubs.client.amqp.auth.Token;
import java.time.Duration;
import java.util.Date;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.qpid.protonj2.client.Delivery;
import org.apache.qpid.protonj2.client.DeliveryMode;
import org.apache.qpid.protonj2.client.Message;
import org.apache.qpid.protonj2.client.Receiver;
import org.apache.qpid.protonj2.client.ReceiverOptions;
import org.apache.qpid.protonj2.client.Sender;
import org.apache.qpid.protonj2.client.SenderOptions;
import org.apache.qpid.protonj2.client.Session;
import org.apache.qpid.protonj2.client.exceptions.ClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request/response link pair to the claims-based-security node of a connection.
 *
 * <p>Requests are serialized, a put-token waits for its response before the next one is sent.
 */
final class ProtonCbsLink implements AutoCloseable {

  static final String OPERATION = "operation";
  static final String PUT_TOKEN = "put-token";
  static final String TYPE = "type";
  static final String NAME = "name";
  static final String EXPIRATION = "expiration";
  static final String STATUS_CODE = "status-code";
  static final String STATUS_DESCRIPTION = "status-description";

  private static final Logger LOGGER = LoggerFactory.getLogger(ProtonCbsLink.class);

  private static final String REPLY_TO = "cbs-reply";

  private final Sender sender;
  private final Receiver receiver;
  private final Lock lock = new ReentrantLock();

  private ProtonCbsLink(Sender sender, Receiver receiver) {
    this.sender = sender;
    this.receiver = receiver;
  }

  static ProtonCbsLink open(Session session, Duration timeout) throws ClientException {
    String linkName = "cbs-" + UUID.randomUUID();
    Sender sender =
        session.openSender(
            AmqpProperties.CBS_ADDRESS,
            new SenderOptions()
                .deliveryMode(DeliveryMode.AT_MOST_ONCE)
                .linkName(linkName + "-sender"));
    Receiver receiver =
        session.openReceiver(
            AmqpProperties.CBS_ADDRESS,
            new ReceiverOptions()
                .deliveryMode(DeliveryMode.AT_MOST_ONCE)
                .linkName(linkName + "-receiver")
                .creditWindow(1));
    try {
      sender.openFuture().get(timeout.toMillis(), MILLISECONDS);
      receiver.openFuture().get(timeout.toMillis(), MILLISECONDS);
    } catch (Exception e) {
      Utils.maybeClose(sender, ex -> LOGGER.debug("Error while closing CBS sender", ex));
      Utils.maybeClose(receiver, ex -> LOGGER.debug("Error while closing CBS receiver", ex));
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new AmqpException.AmqpLinkException("Error while opening CBS link", e);
    }
    LOGGER.debug("CBS link '{}' opened", linkName);
    return new ProtonCbsLink(sender, receiver);
  }

  void putToken(String audience, Token token, Duration timeout) {
    this.lock.lock();
    try {
      String messageId = UUID.randomUUID().toString();
      Message<String> request =
          Message.create(token.value())
              .messageId(messageId)
              .to(AmqpProperties.CBS_ADDRESS)
              .replyTo(REPLY_TO)
              .property(OPERATION, PUT_TOKEN)
              .property(TYPE, token.type())
              .property(NAME, audience)
              .property(EXPIRATION, Date.from(token.expirationTime()));
      LOGGER.debug("Sending put-token request {} for '{}'", messageId, audience);
      this.sender.send(request);
      Delivery delivery = this.receiver.receive(timeout.toMillis(), MILLISECONDS);
      if (delivery == null) {
        throw new AmqpException.AmqpTimeoutException(
            "No response to put-token request for '%s' after %d ms", audience, timeout.toMillis());
      }
      Message<?> response = delivery.message();
      Object statusCode = response.property(STATUS_CODE);
      int status = statusCode instanceof Number ? ((Number) statusCode).intValue() : -1;
      if (status != 200 && status != 202) {
        throw new AmqpException.AmqpAuthorizationException(
            "Put-token request for '%s' failed: %d (%s)",
            audience, status, response.property(STATUS_DESCRIPTION));
      }
      LOGGER.debug("Put-token request {} for '{}' accepted ({})", messageId, audience, status);
    } catch (ClientException e) {
      throw ExceptionUtils.convert(e, "Error during put-token request for '%s'", audience);
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public void close() {
    Utils.maybeClose(
        this.sender, e -> LOGGER.info("Error while closing CBS sender: {}", e.getMessage()));
    Utils.maybeClose(
        this.receiver, e -> LOGGER.info("Error while closing CBS receiver: {}", e.getMessage()));
  }
}
