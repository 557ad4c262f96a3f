package dtm.minidi.introspection;

import dtm.minidi.exceptions.NewInstanceException;

import java.util.List;

/**
 * Fornece ao contêiner a assinatura do construtor de uma classe.
 *
 * A inspeção não tem efeitos colaterais: apenas lê os metadados de tipo da classe.
 */
public interface TypeIntrospector {

    /**
     * Escolhe o construtor usado para injeção e descreve seus parâmetros.
     *
     * @param <T>       tipo da classe inspecionada
     * @param reference classe a ser inspecionada
     * @return assinatura do construtor com os parâmetros em ordem de declaração
     * @throws NewInstanceException se a classe não puder ser instanciada (interface, classe abstrata,
     *                              enum, construtores ambíguos...)
     */
    <T> ConstructorSignature<T> inspect(Class<T> reference) throws NewInstanceException;

    /**
     * Lista os parâmetros do construtor de injeção na ordem de declaração.
     * Uma classe sem parâmetros devolve lista vazia.
     *
     * @param reference classe a ser inspecionada
     * @return parâmetros do construtor
     */
    default List<ConstructorParameter> parametersOf(Class<?> reference) throws NewInstanceException {
        return inspect(reference).getParameters();
    }
}
