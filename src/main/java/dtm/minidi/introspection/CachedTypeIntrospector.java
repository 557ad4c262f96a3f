package dtm.minidi.introspection;

import dtm.minidi.exceptions.NewInstanceException;
import lombok.Getter;
import lombok.NonNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decorador que memoriza a assinatura do construtor por classe.
 * Falhas de inspeção não são memorizadas.
 */
@SuppressWarnings("unchecked")
public class CachedTypeIntrospector implements TypeIntrospector {

    @Getter
    private final TypeIntrospector delegate;
    private final Map<Class<?>, ConstructorSignature<?>> signatures;

    public CachedTypeIntrospector(@NonNull TypeIntrospector delegate) {
        this.delegate = delegate;
        this.signatures = new ConcurrentHashMap<>();
    }

    @Override
    public <T> ConstructorSignature<T> inspect(@NonNull Class<T> reference) throws NewInstanceException {
        ConstructorSignature<?> signature = signatures.get(reference);
        if(signature == null){
            signature = delegate.inspect(reference);
            signatures.putIfAbsent(reference, signature);
        }
        return (ConstructorSignature<T>) signature;
    }

    public int size() {
        return signatures.size();
    }
}
