package io.volunteerhub.emails.workshop;

public enum TaskRole {
  INSTRUCTOR("instructor"),
  HOST("host"),
  SUPPORTING_INSTRUCTOR("supporting-instructor");

  private final String key;

  TaskRole(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
