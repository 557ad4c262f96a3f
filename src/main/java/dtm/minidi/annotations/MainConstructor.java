package dtm.minidi.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marca o construtor que o contêiner deve usar quando a classe declara mais de um.
 *
 * Apenas um construtor por classe pode carregar esta anotação.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.CONSTRUCTOR)
public @interface MainConstructor {
}
