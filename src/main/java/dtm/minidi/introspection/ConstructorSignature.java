package dtm.minidi.introspection;

import lombok.Getter;
import lombok.NonNull;

import java.lang.reflect.Constructor;
import java.util.List;

@Getter
public class ConstructorSignature<T> {
    private final Class<T> referenceClass;
    private final Constructor<T> constructor;
    private final List<ConstructorParameter> parameters;

    public ConstructorSignature(@NonNull Class<T> referenceClass, @NonNull Constructor<T> constructor, @NonNull List<ConstructorParameter> parameters) {
        this.referenceClass = referenceClass;
        this.constructor = constructor;
        this.parameters = List.copyOf(parameters);
    }

    public boolean hasParameters() {
        return !parameters.isEmpty();
    }

    @Override
    public String toString() {
        return constructor.toGenericString();
    }
}
