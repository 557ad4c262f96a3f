package dtm.minidi.core;

import dtm.minidi.exceptions.CircularDependencyException;
import dtm.minidi.exceptions.NewInstanceException;
import dtm.minidi.exceptions.UnresolvableParameterException;
import dtm.minidi.prototypes.Dependency;

import java.util.List;
import java.util.Set;

/**
 * Interface responsável por fornecer acesso às dependências registradas no contêiner.
 */
public interface DependencyContainerGetter {
    /**
     * Obtém a instância única associada à classe de referência.
     * <p>
     * Se a classe ainda não estiver no contêiner, ela é construída junto com todas as
     * dependências do seu construtor, e o resultado fica guardado para as próximas chamadas.
     * Exceções lançadas pelo próprio construtor da classe são propagadas sem alteração.
     *
     * @param <T>       tipo da dependência esperada
     * @param reference classe que representa o tipo da dependência
     * @return instância da dependência
     * @throws UnresolvableParameterException se um parâmetro do construtor não for injetável
     * @throws CircularDependencyException    se a classe depender, direta ou indiretamente, de si mesma
     * @throws NewInstanceException           se a classe não puder ser instanciada
     */
    <T> T getDependency(Class<T> reference);

    /**
     * Indica se o contêiner já possui uma instância para a classe, construída ou registrada.
     *
     * @param reference classe de referência
     * @return true se houver uma instância registrada
     */
    boolean isRegistered(Class<?> reference);

    /**
     * Retorna a lista de dependências registradas no contêiner.
     *
     * @return cópia da lista com as dependências registradas
     */
    List<Dependency> getRegisteredDependencies();

    Set<Class<?>> getRegisteredClasses();
}
