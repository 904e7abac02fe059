package io.volunteerhub.emails.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ContextUriTest {

  @Test
  void parse_entityReference() {
    var id = UUID.randomUUID();

    var parsed = ContextUri.parse("ref:person#" + id);

    assertThat(parsed).isEqualTo(EntityRef.of(EntityKind.PERSON, id));
    assertThat(parsed.uri()).isEqualTo("ref:person#" + id);
  }

  @Test
  void parse_keepsHashInsideLiteral() {
    var parsed = ContextUri.parse("val:str#room #4");

    assertThat(parsed).isInstanceOf(ScalarValue.class);
    assertThat(((ScalarValue) parsed).value()).isEqualTo("room #4");
  }

  @Test
  void scalar_preservesEveryType() {
    var date = LocalDate.of(2026, 3, 14);

    assertThat(ScalarValue.of("hello").value()).isEqualTo("hello");
    assertThat(ScalarValue.of(42L).value()).isEqualTo(42L);
    assertThat(ScalarValue.of(2.5d).value()).isEqualTo(2.5d);
    assertThat(ScalarValue.of(true).value()).isEqualTo(true);
    assertThat(ScalarValue.of(date).value()).isEqualTo(date);
    assertThat(ScalarValue.none().value()).isNull();
  }

  @Test
  void scalar_writesCanonicalUris() {
    assertThat(ScalarValue.of(42L).uri()).isEqualTo("val:int#42");
    assertThat(ScalarValue.of(LocalDate.of(2026, 1, 2)).uri()).isEqualTo("val:date#2026-01-02");
    assertThat(ScalarValue.of(false).uri()).isEqualTo("val:bool#false");
    assertThat(ScalarValue.none().uri()).isEqualTo("val:none#");
  }

  @Test
  void scalar_rejectsNumbersThatWouldNotReadBackEqual() {
    assertThatThrownBy(() -> ScalarValue.of(5))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("java.lang.Integer");
    assertThatThrownBy(() -> ScalarValue.of(1.5f)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void bool_acceptsShortTrueForms() {
    assertThat(((ScalarValue) ContextUri.parse("val:bool#T")).value()).isEqualTo(true);
    assertThat(((ScalarValue) ContextUri.parse("val:bool#1")).value()).isEqualTo(true);
    assertThat(((ScalarValue) ContextUri.parse("val:bool#no")).value()).isEqualTo(false);
  }

  @Test
  void emptyString_roundTrips() {
    var uri = ScalarValue.of("").uri();

    assertThat(((ScalarValue) ContextUri.parse(uri)).value()).isEqualTo("");
  }

  @Test
  void parse_rejectsUnknownScheme() {
    assertThatThrownBy(() -> ContextUri.parse("http:person#1"))
        .isInstanceOf(InvalidContextUriException.class);
  }

  @Test
  void parse_rejectsUnknownEntityKind() {
    assertThatThrownBy(() -> ContextUri.parse("ref:invoice#" + UUID.randomUUID()))
        .isInstanceOf(InvalidContextUriException.class);
  }

  @Test
  void parse_rejectsMalformedUris() {
    assertThatThrownBy(() -> ContextUri.parse("no-separators"))
        .isInstanceOf(InvalidContextUriException.class);
    assertThatThrownBy(() -> ContextUri.parse("ref:person#not-a-uuid"))
        .isInstanceOf(InvalidContextUriException.class);
    assertThatThrownBy(() -> ContextUri.parse("val:int#"))
        .isInstanceOf(InvalidContextUriException.class);
  }

  @Test
  void value_rejectsUnparseableLiteral() {
    var scalar = (ScalarValue) ContextUri.parse("val:int#twelve");

    assertThatThrownBy(scalar::value).isInstanceOf(InvalidContextUriException.class);
  }

  @Test
  void recipientLink_requiresExactlyOneForm() {
    assertThatThrownBy(() -> new RecipientLink(null, null, null))
        .isInstanceOf(InvalidContextUriException.class);
    assertThatThrownBy(() -> new RecipientLink("ref:person#x", "email", "val:str#a@b.c"))
        .isInstanceOf(InvalidContextUriException.class);
  }
}
