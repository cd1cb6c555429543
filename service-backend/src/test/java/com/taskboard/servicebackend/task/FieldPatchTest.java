package com.taskboard.servicebackend.task;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldPatchTest {

    @Test
    void statesCompareByStateAndValue() {
        assertThat(FieldPatch.<String>unset()).isEqualTo(FieldPatch.unset());
        assertThat(FieldPatch.<String>clear()).isEqualTo(FieldPatch.clear());
        assertThat(FieldPatch.<String>clear()).isNotEqualTo(FieldPatch.unset());
        assertThat(FieldPatch.set("a")).isEqualTo(FieldPatch.set("a")).isNotEqualTo(FieldPatch.set("b"));
        assertThat(FieldPatch.<String>clear().hashCode()).isEqualTo(FieldPatch.<Integer>clear().hashCode());
    }

    @Test
    void onlySetPatchesCarryAValue() {
        FieldPatch<String> cleared = FieldPatch.clear();

        assertThat(cleared.isPresent()).isTrue();
        assertThat(cleared.isSet()).isFalse();
        assertThat(cleared.valueOrNull()).isNull();
        assertThatThrownBy(cleared::value).isInstanceOf(IllegalStateException.class);

        assertThat(FieldPatch.unset().isPresent()).isFalse();
        assertThat(FieldPatch.set(3).value()).isEqualTo(3);
        assertThat(FieldPatch.set(3)).hasToString("SET(3)");
    }
}
