package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.context.RecipientLink;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content a trigger wants stored on its scheduled email: when to send, the serialized context, the
 * recipient addresses as known now, and the links used to re-read them at send time.
 */
public record EmailAction(
    Instant scheduledAt,
    Map<String, Object> context,
    List<String> recipients,
    List<RecipientLink> recipientLinks) {

  public EmailAction {
    context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    recipients = List.copyOf(recipients);
    recipientLinks = List.copyOf(recipientLinks);
  }

  public List<Map<String, String>> recipientLinkMaps() {
    return recipientLinks.stream().map(RecipientLink::toMap).toList();
  }
}
