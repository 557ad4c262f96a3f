package dtm.minidi.introspection;

import dtm.minidi.annotations.MainConstructor;
import dtm.minidi.exceptions.NewInstanceException;
import org.junit.Test;

import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.fest.assertions.Assertions.assertThat;
import static org.junit.Assert.fail;

@SuppressWarnings("unused")
public final class ReflectionTypeIntrospectorTest {

    private final TypeIntrospector introspector = new ReflectionTypeIntrospector();

    @Test
    public void noArgClassHasNoParameters() {
        assertThat(introspector.parametersOf(Plain.class)).isEmpty();
    }

    @Test
    public void parametersFollowDeclarationOrder() {
        List<ConstructorParameter> parameters = introspector.parametersOf(Mixed.class);

        assertThat(parameters).hasSize(4);
        assertThat(parameters.get(0).getType()).isEqualTo(Plain.class);
        assertThat(parameters.get(0).isResolvable()).isTrue();
        assertThat(parameters.get(1).getType()).isEqualTo(long.class);
        assertThat(parameters.get(1).isResolvable()).isFalse();
        assertThat(parameters.get(2).getType()).isEqualTo(Runnable.class);
        assertThat(parameters.get(2).isResolvable()).isTrue();
        assertThat(parameters.get(3).getType()).isEqualTo(Boolean.class);
        assertThat(parameters.get(3).isResolvable()).isFalse();
        for (int i = 0; i < parameters.size(); i++) {
            assertThat(parameters.get(i).getIndex()).isEqualTo(i);
        }
    }

    @Test
    public void valueTypesAreUnresolvable() {
        List<ConstructorParameter> parameters = introspector.parametersOf(ValueTypes.class);

        assertThat(parameters).hasSize(6);
        for (ConstructorParameter parameter : parameters) {
            assertThat(parameter.isResolvable()).isFalse();
        }
    }

    @Test
    public void typeVariableIsUnresolvable() {
        List<ConstructorParameter> parameters = introspector.parametersOf(Holder.class);

        assertThat(parameters).hasSize(1);
        assertThat(parameters.get(0).isResolvable()).isFalse();
    }

    @Test
    public void parameterizedTypeUsesRawClass() {
        List<ConstructorParameter> parameters = introspector.parametersOf(UsesHolder.class);

        assertThat(parameters.get(0).getType()).isEqualTo(Holder.class);
        assertThat(parameters.get(0).isResolvable()).isTrue();
    }

    @Test
    public void mainConstructorWins() {
        ConstructorSignature<Annotated> signature = introspector.inspect(Annotated.class);

        assertThat(signature.getParameters()).hasSize(1);
        assertThat(signature.getParameters().get(0).getType()).isEqualTo(Plain.class);
    }

    @Test
    public void noArgConstructorPreferredWhenSeveralExist() {
        ConstructorSignature<TwoConstructors> signature = introspector.inspect(TwoConstructors.class);

        assertThat(signature.hasParameters()).isFalse();
    }

    @Test
    public void ambiguousConstructorsRejected() {
        try {
            introspector.inspect(Ambiguous.class);
            fail();
        } catch (NewInstanceException expected) {
            assertThat(expected.getReferenceClass()).isEqualTo(Ambiguous.class);
        }
    }

    @Test
    public void severalMainConstructorsRejected() {
        try {
            introspector.inspect(TwoMainConstructors.class);
            fail();
        } catch (NewInstanceException expected) {
        }
    }

    @Test
    public void nonConcreteTypesRejected() {
        Class<?>[] types = { Runnable.class, AbstractThing.class, TimeUnit.class, int.class, String[].class };
        for (Class<?> type : types) {
            try {
                introspector.inspect(type);
                fail(type.getName());
            } catch (NewInstanceException expected) {
                assertThat(expected.getReferenceClass()).isEqualTo(type);
            }
        }
    }

    @Test
    public void privateConstructorIsMadeAccessible() throws Exception {
        ConstructorSignature<Hidden> signature = introspector.inspect(Hidden.class);

        assertThat(signature.getConstructor().newInstance()).isNotNull();
    }

    @Test
    public void inaccessibleConstructorIsReported() {
        try {
            introspector.inspect(Runtime.class);
            fail();
        } catch (NewInstanceException expected) {
            assertThat(expected.getReferenceClass()).isEqualTo(Runtime.class);
            assertThat(expected.getCause().getClass()).isEqualTo(InaccessibleObjectException.class);
        }
    }

    @Test
    public void parameterNamesAreAvailable() {
        List<ConstructorParameter> parameters = introspector.parametersOf(Mixed.class);

        assertThat(parameters.get(1).getName()).isEqualTo("timeout");
    }

    @Test
    public void constructorParameterHasNoMutators() {
        for (Method method : ConstructorParameter.class.getMethods()) {
            assertThat(method.getName().startsWith("set")).isFalse();
        }
        for (Field field : ConstructorParameter.class.getDeclaredFields()) {
            assertThat(Modifier.isFinal(field.getModifiers())).isTrue();
        }
    }

    @Test
    public void cachedSignatureCannotBeChanged() {
        CachedTypeIntrospector cached = new CachedTypeIntrospector(introspector);
        List<ConstructorParameter> parameters = cached.parametersOf(Mixed.class);
        try {
            parameters.set(1, new ConstructorParameter(1, "timeout", Plain.class, Plain.class, true));
            fail();
        } catch (UnsupportedOperationException expected) {
        }

        ConstructorParameter timeout = cached.parametersOf(Mixed.class).get(1);
        assertThat(timeout.getType()).isEqualTo(long.class);
        assertThat(timeout.isResolvable()).isFalse();
    }

    @Test
    public void cachedIntrospectorReusesSignature() {
        CachedTypeIntrospector cached = new CachedTypeIntrospector(introspector);

        ConstructorSignature<Mixed> first = cached.inspect(Mixed.class);
        ConstructorSignature<Mixed> second = cached.inspect(Mixed.class);

        assertThat(first).isSameAs(second);
        assertThat(cached.size()).isEqualTo(1);
    }

    @Test
    public void cachedIntrospectorDoesNotKeepFailures() {
        CachedTypeIntrospector cached = new CachedTypeIntrospector(introspector);
        try {
            cached.inspect(Ambiguous.class);
            fail();
        } catch (NewInstanceException expected) {
        }
        assertThat(cached.size()).isEqualTo(0);
    }

    static class Plain {
    }

    static class Mixed {
        Mixed(Plain plain, long timeout, Runnable task, Boolean flag) {
        }
    }

    static class ValueTypes {
        ValueTypes(String name, Integer count, BigDecimal amount, Object untyped, TimeUnit unit, byte[] bytes) {
        }
    }

    static class Holder<T> {
        Holder(T value) {
        }
    }

    static class UsesHolder {
        UsesHolder(Holder<Plain> holder) {
        }
    }

    static class Annotated {
        Annotated() {
        }

        @MainConstructor
        Annotated(Plain plain) {
        }
    }

    static class TwoConstructors {
        TwoConstructors() {
        }

        TwoConstructors(Plain plain) {
        }
    }

    static class Ambiguous {
        Ambiguous(Plain plain) {
        }

        Ambiguous(Mixed mixed) {
        }
    }

    static class TwoMainConstructors {
        @MainConstructor
        TwoMainConstructors(Plain plain) {
        }

        @MainConstructor
        TwoMainConstructors(Mixed mixed) {
        }
    }

    abstract static class AbstractThing {
    }

    static class Hidden {
        private Hidden() {
        }
    }
}
