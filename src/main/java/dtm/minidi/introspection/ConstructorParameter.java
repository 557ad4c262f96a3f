package dtm.minidi.introspection;

import lombok.Value;

import java.lang.reflect.Type;

/**
 * Um parâmetro declarado no construtor escolhido para injeção.
 * <p>
 * Quando {@code resolvable} é {@code false} o parâmetro é o marcador "Unresolvable":
 * seu tipo não é uma classe que o contêiner saiba construir.
 */
@Value
public class ConstructorParameter {
    int index;
    String name;
    Class<?> type;
    Type genericType;
    boolean resolvable;
}
