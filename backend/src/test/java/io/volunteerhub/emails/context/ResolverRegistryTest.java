package io.volunteerhub.emails.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ResolverRegistryTest {

  @Test
  void resolve_delegatesToResolverForKind() {
    var id = UUID.randomUUID();
    var people = resolver(EntityKind.PERSON);
    when(people.load(id)).thenReturn(Optional.of(Map.of("fullName", "Ada")));
    var registry = new ResolverRegistry(List.of(people));

    assertThat(registry.resolve(EntityRef.of(EntityKind.PERSON, id)))
        .containsEntry("fullName", "Ada");
    assertThat(registry.supports(EntityKind.PERSON)).isTrue();
    assertThat(registry.supports(EntityKind.TASK)).isFalse();
  }

  @Test
  void resolve_missingEntityIsDangling() {
    var id = UUID.randomUUID();
    var people = resolver(EntityKind.PERSON);
    when(people.load(id)).thenReturn(Optional.empty());
    var registry = new ResolverRegistry(List.of(people));

    assertThatThrownBy(() -> registry.resolve(EntityRef.of(EntityKind.PERSON, id)))
        .isInstanceOfSatisfying(
            DanglingReferenceException.class,
            e -> assertThat(e.getUri()).isEqualTo("ref:person#" + id));
  }

  @Test
  void resolve_unregisteredKindIsDangling() {
    var registry = new ResolverRegistry(List.of(resolver(EntityKind.PERSON)));

    assertThatThrownBy(() -> registry.resolve(EntityRef.of(EntityKind.AWARD, UUID.randomUUID())))
        .isInstanceOf(DanglingReferenceException.class);
  }

  @Test
  void duplicateResolversAreRejected() {
    var first = resolver(EntityKind.WORKSHOP);
    var second = resolver(EntityKind.WORKSHOP);

    assertThatThrownBy(() -> new ResolverRegistry(List.of(first, second)))
        .isInstanceOf(IllegalStateException.class);
  }

  private static EntityResolver resolver(EntityKind kind) {
    var resolver = mock(EntityResolver.class);
    when(resolver.kind()).thenReturn(kind);
    return resolver;
  }
}
