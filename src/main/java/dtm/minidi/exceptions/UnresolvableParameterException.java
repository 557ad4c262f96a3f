package dtm.minidi.exceptions;

import lombok.Getter;

/**
 * Lançada quando um parâmetro do construtor não é uma classe que o contêiner consiga construir
 * (tipo primitivo, {@link String}, número, enum, array, variável de tipo...) e a classe dona
 * do construtor não foi registrada manualmente.
 */
@Getter
public class UnresolvableParameterException extends DependencyContainerException {
    private final Class<?> referenceClass;
    private final int parameterIndex;
    private final String parameterName;
    private final Class<?> parameterType;

    public UnresolvableParameterException(Class<?> referenceClass, int parameterIndex, String parameterName, Class<?> parameterType) {
        super(String.format(
                "Não foi possível construir %s: o parâmetro %d do construtor (%s %s) não é uma dependência injetável. " +
                        "Registre uma instância de %s manualmente.",
                referenceClass.getName(),
                parameterIndex,
                parameterType.getTypeName(),
                parameterName,
                referenceClass.getSimpleName()
        ));
        this.referenceClass = referenceClass;
        this.parameterIndex = parameterIndex;
        this.parameterName = parameterName;
        this.parameterType = parameterType;
    }
}
