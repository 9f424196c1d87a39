package com.protocolguide.api.billing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.protocolguide.saas.domain.model.BillingEvent;
import com.protocolguide.saas.domain.model.BillingEventPayload;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookAuthenticatorTest {

  private static final String SECRET = "whsec_unit";
  private static final long NOW = 1_700_000_000L;
  private static final byte[] BODY = """
      {"id":"evt_1","type":"customer.subscription.updated","created":1700000000,
       "data":{"object":{"id":"sub_1","customer":"cus_1","status":"active","current_period_end":1702592000}}}
      """.getBytes(StandardCharsets.UTF_8);

  private final WebhookAuthenticator auth = new WebhookAuthenticator(
      new BillingEventDecoder(new ObjectMapper()),
      Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC),
      Duration.ofSeconds(300));

  @Test
  void acceptsValidSignatureAndDecodes() throws Exception {
    BillingEvent event = auth.verify(BODY, List.of(WebhookAuthenticator.sign(SECRET, NOW, BODY)), SECRET);

    assertThat(event.id()).isEqualTo("evt_1");
    assertThat(event.type()).isEqualTo("customer.subscription.updated");
    assertThat(event.payload()).isInstanceOf(BillingEventPayload.SubscriptionChanged.class);
    assertThat(event.rawJson()).contains("sub_1");
  }

  @Test
  void acceptsWhenAnyOfSeveralSignaturesMatches() throws Exception {
    String good = WebhookAuthenticator.sign(SECRET, NOW, BODY);
    String header = "t=" + NOW + ",v1=" + "0".repeat(64) + "," + good.substring(good.indexOf("v1=")) + ",v0=abc";

    assertThat(auth.verify(BODY, List.of(header), SECRET).id()).isEqualTo("evt_1");
  }

  @Test
  void toleranceBoundaryIsInclusive() throws Exception {
    assertThat(auth.verify(BODY, List.of(WebhookAuthenticator.sign(SECRET, NOW - 300, BODY)), SECRET)).isNotNull();
    assertThat(auth.verify(BODY, List.of(WebhookAuthenticator.sign(SECRET, NOW + 300, BODY)), SECRET)).isNotNull();
  }

  @Test
  void rejectsStaleAndFutureTimestamps() {
    assertThatThrownBy(() -> auth.verify(BODY, List.of(WebhookAuthenticator.sign(SECRET, NOW - 301, BODY)), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("Timestamp outside the tolerance zone");
    assertThatThrownBy(() -> auth.verify(BODY, List.of(WebhookAuthenticator.sign(SECRET, NOW + 301, BODY)), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("Timestamp outside the tolerance zone");
  }

  @Test
  void rejectsTimestampsAtTheEdgesOfTheLongRange() {
    // now - t wraps to Long.MIN_VALUE here, whose absolute value is still negative
    long wrapping = NOW + Long.MIN_VALUE;
    for (long t : new long[] {wrapping, Long.MIN_VALUE, Long.MAX_VALUE}) {
      assertThatThrownBy(() -> auth.verify(BODY, List.of(WebhookAuthenticator.sign(SECRET, t, BODY)), SECRET))
          .isInstanceOf(SignatureException.class)
          .hasMessage("Timestamp outside the tolerance zone");
    }
  }

  @Test
  void rejectsMissingOrDuplicatedHeader() {
    assertThatThrownBy(() -> auth.verify(BODY, List.of(), SECRET))
        .isInstanceOf(SignatureException.class).hasMessage("Missing signature");
    String sig = WebhookAuthenticator.sign(SECRET, NOW, BODY);
    assertThatThrownBy(() -> auth.verify(BODY, List.of(sig, sig), SECRET))
        .isInstanceOf(SignatureException.class).hasMessage("Multiple signature headers");
  }

  @Test
  void rejectsMalformedHeaders() {
    assertThatThrownBy(() -> auth.verify(BODY, List.of("v1=abc"), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("Unable to extract timestamp and signatures from header");
    assertThatThrownBy(() -> auth.verify(BODY, List.of("t=notanumber,v1=abc"), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("Unable to extract timestamp and signatures from header");
    assertThatThrownBy(() -> auth.verify(BODY, List.of("t=" + NOW + ",v0=abc"), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("No signatures found with expected scheme");
  }

  @Test
  void rejectsWrongSecretAndTamperedBody() {
    String sig = WebhookAuthenticator.sign("whsec_other", NOW, BODY);
    assertThatThrownBy(() -> auth.verify(BODY, List.of(sig), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("No signatures found matching the expected signature for payload");

    String good = WebhookAuthenticator.sign(SECRET, NOW, BODY);
    byte[] tampered = new String(BODY, StandardCharsets.UTF_8).replace("active", "canceled")
        .getBytes(StandardCharsets.UTF_8);
    assertThatThrownBy(() -> auth.verify(tampered, List.of(good), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("No signatures found matching the expected signature for payload");
  }

  @Test
  void signedButUnparseableBodyIsRejected() {
    byte[] notJson = "not json".getBytes(StandardCharsets.UTF_8);
    assertThatThrownBy(() -> auth.verify(notJson, List.of(WebhookAuthenticator.sign(SECRET, NOW, notJson)), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("Invalid event payload");

    byte[] array = "[1,2]".getBytes(StandardCharsets.UTF_8);
    assertThatThrownBy(() -> auth.verify(array, List.of(WebhookAuthenticator.sign(SECRET, NOW, array)), SECRET))
        .isInstanceOf(SignatureException.class)
        .hasMessage("Invalid event payload");
  }

  @Test
  void blankSecretFailsClosed() {
    assertThatThrownBy(() -> auth.verify(BODY, List.of(WebhookAuthenticator.sign("whsec_unit", NOW, BODY)), " "))
        .isInstanceOf(SignatureException.class)
        .hasMessage("Webhook secret is not configured");
  }
}
