package org.bindforge.analysis.parameters;

import org.bindforge.analysis.RefMode;
import org.bindforge.config.FunctionConfig;
import org.bindforge.config.Ident;
import org.bindforge.config.ParameterConfig;
import org.bindforge.config.StringType;
import org.bindforge.env.Env;
import org.bindforge.junit.extensions.logging.LogWatchExtension;
import org.bindforge.library.Parameter;
import org.bindforge.library.ParameterDirection;
import org.bindforge.library.TestLibrary;
import org.bindforge.library.Transfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bindforge.library.TestLibrary.in;
import static org.bindforge.library.TestLibrary.param;

/**
 * Unit tests for {@link ParameterLowering}: surface/native/transformation building,
 * length folding, ownership resolution, async restructuring and configuration overrides.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ParameterLoweringTest {

    private TestLibrary lib;
    private Env env;

    @BeforeEach
    void setUp() {
        lib = new TestLibrary();
        env = lib.env();
    }

    private ParameterSet lower(List<Parameter> parameters) {
        return ParameterLowering.lower(env, parameters, List.of(), false, false, false);
    }

    private static FunctionConfig function(ParameterConfig... parameters) {
        return new FunctionConfig(new Ident.Name("test_function"), false, false, null, null, null, List.of(parameters));
    }

    private static ParameterConfig parameterConfig(String name, Boolean nullable, boolean constant, String lengthOf,
                                                   StringType stringType) {
        return new ParameterConfig(new Ident.Name(name), nullable, constant, lengthOf, stringType);
    }

    @Test
    void arrayFollowedByLenFoldsTheLengthParameter() {
        ParameterSet set = lower(List.of(
                in("data", lib.byteArray, "const guint8*"),
                in("len", lib.gsize, "gsize")));

        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name).containsExactly("data");
        assertThat(set.nativeParameters()).extracting(NativeParameter::name).containsExactly("data", "len");
        assertThat(set.transformations()).hasSize(2);

        Transformation data = set.transformations().get(0);
        assertThat(data.nativeIndex()).isZero();
        assertThat(data.surfaceIndex()).isZero();
        assertThat(data.type()).isInstanceOf(TransformationType.ToNativePointer.class);

        Transformation len = set.transformations().get(1);
        assertThat(len.nativeIndex()).isEqualTo(1);
        assertThat(len.surfaceIndex()).isNull();
        assertThat(len.type()).isEqualTo(new TransformationType.Length("data", "len", "usize"));
    }

    @Test
    void foldedLengthParameterHasOnlyTheLengthStep() {
        ParameterSet set = lower(List.of(
                in("text", lib.utf8, "const gchar*"),
                in("text_length", lib.gssize, "gssize")));

        assertThat(set.transformationsAt(1))
                .singleElement()
                .extracting(Transformation::type)
                .isInstanceOf(TransformationType.Length.class);
        assertThat(set.surfaceFor(1)).isEmpty();
    }

    @Test
    void asyncFunctionThreadsCallbackAndUserDataThroughTheFuture() {
        ParameterSet set = ParameterLowering.lower(env, List.of(
                lib.self(lib.widget, "TestWidget*"),
                in("io_priority", lib.gint, "int"),
                param("callback", lib.readyCallback).cType("GAsyncReadyCallback")
                        .scope(org.bindforge.library.ParameterScope.ASYNC).closure(3).build(),
                in("user_data", lib.gpointer, "gpointer")), List.of(), false, true, true);

        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name)
                .containsExactly("self", "io_priority", "callback");
        assertThat(set.transformationsAt(2)).singleElement()
                .extracting(Transformation::type)
                .isEqualTo(new TransformationType.ToSome("callback"));
        assertThat(set.transformationsAt(3)).singleElement()
                .satisfies(t -> {
                    assertThat(t.type()).isEqualTo(new TransformationType.IntoRaw("user_data"));
                    assertThat(t.surfaceIndex()).isNull();
                });
        assertThat(set.nativeParameters().get(2).userDataIndex()).isEqualTo(3);
    }

    @Test
    void asyncFunctionDropsParametersEndingInDataFromTheSurface() {
        ParameterSet set = ParameterLowering.lower(env, List.of(
                in("callback", lib.readyCallback, "GAsyncReadyCallback"),
                in("callback_data", lib.gpointer, "gpointer")), List.of(), false, true, false);

        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name).containsExactly("callback");
        // Only the slot literally named user_data is boxed.
        assertThat(set.transformationsAt(1)).singleElement()
                .extracting(Transformation::type)
                .isInstanceOf(TransformationType.ToNativePointer.class);
    }

    @Test
    void synchronousFunctionKeepsUserDataAndCallbackConversions() {
        ParameterSet set = lower(List.of(
                in("callback", lib.readyCallback, "GAsyncReadyCallback"),
                in("user_data", lib.gpointer, "gpointer")));

        assertThat(set.surfaceParameters()).hasSize(2);
        assertThat(set.transformations()).extracting(Transformation::type).containsExactly(
                new TransformationType.ToNativeDirect("callback"),
                new TransformationType.ToNativePointer("user_data", false, Transfer.NONE, RefMode.NONE,
                        "", "", "", false, false));
    }

    @Test
    void scalarParameterDropsTransferAndCallerAllocates() {
        ParameterSet set = lower(List.of(
                param("orientation", lib.orientation).cType("TestOrientation")
                        .transfer(Transfer.FULL).callerAllocates(true).build()));

        NativeParameter par = set.nativeParameters().get(0);
        assertThat(par.transfer()).isEqualTo(Transfer.NONE);
        assertThat(par.callerAllocates()).isFalse();
        assertThat(set.transformations().get(0).type())
                .isEqualTo(new TransformationType.ToNativeScalar("orientation", false));
    }

    @Test
    void aliasOfQuarkLowersAsScalar() {
        ParameterSet set = lower(List.of(param("domain", lib.quarkAlias).cType("TestMyQuark").build()));

        assertThat(set.transformations().get(0).type())
                .isEqualTo(new TransformationType.ToNativeScalar("domain", false));
    }

    @Test
    void pointerParameterKeepsDeclaredOwnership() {
        ParameterSet set = lower(List.of(
                param("child", lib.widget).cType("TestWidget*").transfer(Transfer.FULL).build()));

        assertThat(set.nativeParameters().get(0).transfer()).isEqualTo(Transfer.FULL);
        assertThat(set.transformations().get(0).type())
                .isInstanceOfSatisfying(TransformationType.ToNativePointer.class,
                        p -> assertThat(p.transfer()).isEqualTo(Transfer.FULL));
    }

    @Test
    void nullableOpenClassParameterIsDereferencedAsSharedReference() {
        ParameterSet set = lower(List.of(
                lib.self(lib.label, "TestLabel*"),
                param("parent", lib.widget).cType("TestWidget*").nullable(true).build()));

        assertThat(set.transformations().get(1).type())
                .isInstanceOfSatisfying(TransformationType.ToNativePointer.class, p -> {
                    assertThat(p.toNativeExtra()).isEqualTo(".as_ref()");
                    assertThat(p.nullable()).isTrue();
                });
    }

    @Test
    void nullableFinalClassParameterIsNullableWithoutExtraConversion() {
        ParameterSet set = lower(List.of(
                param("label", lib.label).cType("TestLabel*").nullable(true).build()));

        assertThat(set.transformations().get(0).type())
                .isInstanceOfSatisfying(TransformationType.ToNativePointer.class, p -> {
                    assertThat(p.toNativeExtra()).isEmpty();
                    assertThat(p.nullable()).isTrue();
                });
    }

    @Test
    void nullableReceiverIsNotTreatedAsOptional() {
        ParameterSet set = lower(List.of(
                param("widget", lib.widget).cType("TestWidget*").nullable(true).instanceParameter(true).build()));

        assertThat(set.transformations().get(0).type())
                .isInstanceOfSatisfying(TransformationType.ToNativePointer.class, p -> {
                    assertThat(p.toNativeExtra()).isEmpty();
                    assertThat(p.nullable()).isFalse();
                    assertThat(p.instanceParameter()).isTrue();
                });
    }

    @Test
    void nullableStringIsNotOptionalInTheConversion() {
        ParameterSet set = lower(List.of(
                param("title", lib.utf8).cType("const gchar*").nullable(true).build()));

        assertThat(set.nativeParameters().get(0).nullable()).isTrue();
        assertThat(set.transformations().get(0).type())
                .isInstanceOfSatisfying(TransformationType.ToNativePointer.class,
                        p -> assertThat(p.nullable()).isFalse());
    }

    @Test
    void disabledLengthDetectionKeepsTheLengthCandidateOnTheSurface() {
        List<Parameter> parameters = List.of(
                in("str", lib.utf8, "const gchar*"),
                in("str_len", lib.gssize, "gssize"));

        ParameterSet set = ParameterLowering.lower(env, parameters, List.of(), true, false, false);

        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name).containsExactly("str", "str_len");
        assertThat(set.transformations()).extracting(Transformation::type).containsExactly(
                new TransformationType.ToNativePointer("str", false, Transfer.NONE, RefMode.BY_REF,
                        "", "", "", false, false),
                new TransformationType.ToNativeDirect("str_len"));
    }

    @Test
    void lengthCandidateWithoutPrecedingArrayStaysOnTheSurface() {
        ParameterSet set = lower(List.of(
                in("width", lib.gint, "int"),
                in("len", lib.gsize, "gsize")));

        assertThat(set.surfaceParameters()).hasSize(2);
        assertThat(set.transformations()).noneMatch(t -> t.type() instanceof TransformationType.Length);
    }

    @Test
    void lengthCandidateInFirstPositionIsNotFolded() {
        ParameterSet set = lower(List.of(in("len", lib.gsize, "gsize")));

        assertThat(set.surfaceParameters()).hasSize(1);
        assertThat(set.transformations().get(0).type()).isEqualTo(new TransformationType.ToNativeDirect("len"));
    }

    @Test
    void outLengthCandidateIsNotDetected() {
        ParameterSet set = lower(List.of(
                in("data", lib.byteArray, "guint8*"),
                param("length", lib.gsize).cType("gsize*").direction(ParameterDirection.OUT).build()));

        assertThat(set.transformations()).noneMatch(t -> t.type() instanceof TransformationType.Length);
    }

    @Test
    void lengthDetectionSeesThroughAliases() {
        ParameterSet set = lower(List.of(
                in("buffer", lib.bufferAlias, "TestBufferAlias"),
                in("buffer_len", lib.count, "TestCount")));

        assertThat(set.transformationsAt(1)).singleElement()
                .extracting(Transformation::type)
                .isEqualTo(new TransformationType.Length("buffer", "buffer_len", "Count"));
    }

    @Test
    void declaredArrayLengthLinkFoldsEvenWithDetectionDisabled() {
        List<Parameter> parameters = List.of(
                in("n_items", lib.guint, "guint"),
                param("items", lib.stringArray).cType("const gchar**").arrayLength(0).build());

        ParameterSet set = ParameterLowering.lower(env, parameters, List.of(), true, false, false);

        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name).containsExactly("items");
        assertThat(set.transformations().get(0))
                .isEqualTo(new Transformation(0, null, new TransformationType.Length("items", "n_items", "u32")));
        assertThat(set.transformations().get(1).surfaceIndex()).isZero();
    }

    @Test
    void configuredLengthOfWinsOverDeclaredLink() {
        List<Parameter> parameters = List.of(
                in("first", lib.byteArray, "guint8*"),
                param("second", lib.byteArray).cType("guint8*").arrayLength(2).build(),
                in("count", lib.gsize, "gsize"));

        ParameterSet set = ParameterLowering.lower(env, parameters,
                List.of(function(parameterConfig("count", null, false, "first", null))), false, false, false);

        assertThat(set.transformationsAt(2)).singleElement()
                .extracting(Transformation::type)
                .isEqualTo(new TransformationType.Length("first", "count", "usize"));
    }

    @Test
    void arrayNamesAreKeywordMangled() {
        ParameterSet set = lower(List.of(
                in("type", lib.utf8, "const gchar*"),
                in("type_len", lib.gsize, "gsize")));

        assertThat(set.nativeParameters().get(0).name()).isEqualTo("type_");
        assertThat(set.transformationsAt(1)).singleElement()
                .extracting(Transformation::type)
                .isEqualTo(new TransformationType.Length("type_", "type_len", "usize"));
    }

    @Test
    void receiverKeepsItsDeclaredName() {
        ParameterSet set = lower(List.of(
                param("self", lib.widget).cType("TestWidget*").instanceParameter(true).build(),
                in("ref", lib.widget, "TestWidget*")));

        assertThat(set.nativeParameters()).extracting(NativeParameter::name).containsExactly("self", "ref_");
        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name).containsExactly("self", "ref_");
    }

    @Test
    void returnableOutParameterIsPromotedToTheReturnValue() {
        ParameterSet set = lower(List.of(
                lib.self(lib.widget, "TestWidget*"),
                param("width", lib.gint).cType("int*").direction(ParameterDirection.OUT).build()));

        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name).containsExactly("self");
        assertThat(set.transformations().get(1).surfaceIndex()).isNull();
        assertThat(set.transformations().get(1).nativeIndex()).isEqualTo(1);
    }

    @Test
    void unreturnableOutParameterStaysOnTheSurface() {
        ParameterSet set = lower(List.of(
                param("out_pointer", lib.gpointer).cType("gpointer*").direction(ParameterDirection.OUT).build()));

        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name).containsExactly("out_pointer");
    }

    @Test
    void outParameterOfAsyncFunctionIsNeverOnTheSurface() {
        ParameterSet set = ParameterLowering.lower(env, List.of(
                param("out_pointer", lib.gpointer).cType("gpointer*").direction(ParameterDirection.OUT).build()),
                List.of(), false, true, false);

        assertThat(set.surfaceParameters()).isEmpty();
    }

    @Test
    void inOutAndReturnDirectionsFollowTheirDefaults() {
        ParameterSet set = lower(List.of(
                param("cursor", lib.gint).cType("int*").direction(ParameterDirection.IN_OUT).build(),
                param("result", lib.gint).cType("int").direction(ParameterDirection.RETURN).build()));

        assertThat(set.surfaceParameters()).extracting(SurfaceParameter::name).containsExactly("cursor");
    }

    @Test
    void allowNoneIsCarriedToTheSurface() {
        ParameterSet set = lower(List.of(
                param("cancellable", lib.widget).cType("TestWidget*").allowNone(true).build()));

        assertThat(set.surfaceParameters().get(0).allowNone()).isTrue();
    }

    @Test
    void configuredNullabilityReplacesDeclaredNullability() {
        ParameterSet set = ParameterLowering.lower(env, List.of(
                        param("parent", lib.widget).cType("TestWidget*").nullable(false).build()),
                List.of(function(parameterConfig("parent", true, false, null, null))), false, false, false);

        assertThat(set.nativeParameters().get(0).nullable()).isTrue();
        assertThat(set.transformations().get(0).type())
                .isInstanceOfSatisfying(TransformationType.ToNativePointer.class,
                        p -> assertThat(p.toNativeExtra()).isEqualTo(".as_ref()"));
    }

    @Test
    void constantOverrideMakesExclusiveRecordAccessImmutable() {
        Parameter rect = param("rect", lib.rect).cType("TestRect*").build();

        ParameterSet plain = lower(List.of(rect));
        ParameterSet constant = ParameterLowering.lower(env, List.of(rect),
                List.of(function(parameterConfig("rect", null, true, null, null))), false, false, false);

        assertThat(plain.nativeParameters().get(0).refMode()).isEqualTo(RefMode.BY_REF_MUT);
        assertThat(constant.nativeParameters().get(0).refMode()).isEqualTo(RefMode.BY_REF_IMMUT);
    }

    @Test
    void traitReceiverAvoidsExclusiveAccess() {
        ParameterSet set = ParameterLowering.lower(env, List.of(
                lib.self(lib.widget, "TestWidget*"),
                in("other", lib.widget, "TestWidget*")), List.of(), false, false, true);

        assertThat(set.nativeParameters()).extracting(NativeParameter::refMode)
                .containsExactly(RefMode.BY_REF_FAKE, RefMode.BY_REF);
        assertThat(set.transformations().get(0).type())
                .isInstanceOfSatisfying(TransformationType.ToNativePointer.class,
                        p -> assertThat(p.inTrait()).isTrue());
    }

    @Test
    void configuredStringTypeReplacesTheWorkingType() {
        ParameterSet set = ParameterLowering.lower(env, List.of(in("path", lib.utf8, "const gchar*")),
                List.of(function(parameterConfig("path", null, false, null, StringType.FILENAME))),
                false, false, false);

        assertThat(set.nativeParameters().get(0).typ()).isEqualTo(lib.filename);
        assertThat(set.surfaceParameters().get(0).typ()).isEqualTo(lib.filename);
    }

    @Test
    void configurationForOtherParametersIsIgnored() {
        ParameterSet set = ParameterLowering.lower(env, List.of(in("width", lib.gint, "int")),
                List.of(function(parameterConfig("height", true, true, "data", StringType.FILENAME))),
                false, false, false);

        assertThat(set.surfaceParameters()).hasSize(1);
        assertThat(set.nativeParameters().get(0).nullable()).isFalse();
    }

    @Test
    void unknownTypeProducesUnknownStep() {
        ParameterSet set = lower(List.of(in("args", lib.varArgs, "va_list")));

        assertThat(set.transformations().get(0).type()).isEqualTo(new TransformationType.ToNativeUnknown("args"));
    }

    @Test
    void borrowedCustomTypeProducesBorrowStep() {
        ParameterSet set = lower(List.of(in("name", lib.borrowedStr, "const char*")));

        assertThat(set.transformations().get(0).type()).isEqualTo(new TransformationType.ToNativeBorrow());
    }

    @Test
    void emptyParameterListLowersToEmptySet() {
        ParameterSet set = lower(List.of());

        assertThat(set.surfaceParameters()).isEmpty();
        assertThat(set.nativeParameters()).isEmpty();
        assertThat(set.transformations()).isEmpty();
    }

    @Test
    void indicesStayConsistentAcrossMixedSignatures() {
        List<List<Parameter>> signatures = List.of(
                List.of(lib.self(lib.widget, "TestWidget*"),
                        in("data", lib.byteArray, "const guint8*"),
                        in("len", lib.gsize, "gsize"),
                        param("written", lib.gsize).cType("gsize*").direction(ParameterDirection.OUT).build(),
                        param("error", lib.gpointer).cType("GError**").direction(ParameterDirection.OUT).error(true).build()),
                List.of(in("n", lib.guint, "guint"),
                        param("values", lib.stringArray).cType("gchar**").arrayLength(0).build(),
                        in("callback", lib.readyCallback, "GAsyncReadyCallback"),
                        in("user_data", lib.gpointer, "gpointer")),
                List.of(in("text", lib.utf8, "const gchar*"), in("length", lib.gssize, "gssize"),
                        in("flags", lib.flags, "TestStateFlags")));

        for (boolean async : new boolean[]{false, true}) {
            for (List<Parameter> signature : signatures) {
                ParameterSet set = ParameterLowering.lower(env, signature, List.of(), false, async, false);

                assertThat(set.nativeParameters()).hasSameSizeAs(signature);
                for (Transformation t : set.transformations()) {
                    assertThat(t.nativeIndex()).isBetween(0, set.nativeParameters().size() - 1);
                    if (t.hasSurfaceIndex()) {
                        assertThat(t.surfaceIndex()).isBetween(0, set.surfaceParameters().size() - 1);
                        assertThat(set.surfaceParameters().get(t.surfaceIndex()).nativeIndex())
                                .isEqualTo(t.nativeIndex());
                    }
                }
                for (int i = 0; i < signature.size(); i++) {
                    List<Transformation> at = set.transformationsAt(i);
                    assertThat(at.stream().filter(t -> t.type().isToNative()).count()).isLessThanOrEqualTo(1);
                    assertThat(at.stream().filter(t -> !t.type().isToNative()).count()).isLessThanOrEqualTo(1);
                }
            }
        }
    }

    @Test
    void returnLengthIsAppendedWithoutSurfaceIndex() {
        ParameterSet set = lower(List.of(
                lib.self(lib.widget, "TestWidget*"),
                param("n_children", lib.guint).cType("guint*").direction(ParameterDirection.OUT).build()));
        Parameter ret = param("", lib.widgetList).direction(ParameterDirection.RETURN).arrayLength(1).build();

        set.appendReturnLength(env, Optional.of(ret));

        assertThat(set.transformations()).last()
                .isEqualTo(new Transformation(1, null, new TransformationType.Length("", "n_children", "u32")));
        assertThat(set.transformationsAt(1)).hasSize(2);
    }
}
