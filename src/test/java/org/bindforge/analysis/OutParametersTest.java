package org.bindforge.analysis;

import org.bindforge.env.Env;
import org.bindforge.library.ParameterDirection;
import org.bindforge.library.TestLibrary;
import org.bindforge.library.TypeId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bindforge.library.TestLibrary.param;

@Tag("unit")
class OutParametersTest {

    private TestLibrary lib;
    private Env env;

    @BeforeEach
    void setUp() {
        lib = new TestLibrary();
        env = lib.env();
    }

    private boolean canAsReturn(TypeId typ, Integer arrayLength) {
        return OutParameters.canAsReturn(env, param("out", typ).direction(ParameterDirection.OUT)
                .arrayLength(arrayLength).build());
    }

    @Test
    void valuesAndExpressibleObjectsAreReturnable() {
        assertThat(canAsReturn(lib.gint, null)).isTrue();
        assertThat(canAsReturn(lib.orientation, null)).isTrue();
        assertThat(canAsReturn(lib.utf8, null)).isTrue();
        assertThat(canAsReturn(lib.widget, null)).isTrue();
        assertThat(canAsReturn(lib.stringArray, null)).isTrue();
    }

    @Test
    void opaqueAndUnknownValuesAreNotReturnable() {
        assertThat(canAsReturn(lib.gpointer, null)).isFalse();
        assertThat(canAsReturn(lib.varArgs, null)).isFalse();
        assertThat(canAsReturn(lib.borrowedStr, null)).isFalse();
    }

    @Test
    void plainValueArraysNeedALength() {
        assertThat(canAsReturn(lib.byteArray, null)).isFalse();
        assertThat(canAsReturn(lib.byteArray, 1)).isTrue();
    }
}
