package io.volunteerhub.emails.trigger;

import io.volunteerhub.emails.context.EntityKind;
import java.util.Arrays;

/** Business events that can cause an automated email. Each kind has one active template. */
public enum TriggerKind {
  INSTRUCTOR_BADGE_AWARDED("instructor-badge-awarded", EntityKind.AWARD),
  HOST_INSTRUCTORS_INTRODUCTION("host-instructors-introduction", EntityKind.WORKSHOP),
  POST_WORKSHOP_7DAYS("post-workshop-7days", EntityKind.WORKSHOP),
  INSTRUCTOR_TASK_CREATED_FOR_WORKSHOP("instructor-task-created-for-workshop", EntityKind.TASK);

  private final String key;
  private final EntityKind subjectKind;

  TriggerKind(String key, EntityKind subjectKind) {
    this.key = key;
    this.subjectKind = subjectKind;
  }

  public String key() {
    return key;
  }

  /** Kind of entity a scheduled email of this trigger is about. */
  public EntityKind subjectKind() {
    return subjectKind;
  }

  public static TriggerKind fromKey(String key) {
    return Arrays.stream(values())
        .filter(kind -> kind.key.equals(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown trigger: " + key));
  }
}
