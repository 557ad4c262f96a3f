package dtm.minidi.core;

/**
 * Interface para registro manual de dependências no contêiner.
 */
public interface DependencyContainerRegistor {

    /**
     * Registra a instância que o contêiner deve devolver para a classe, substituindo
     * qualquer instância anterior.
     * <p>
     * A substituição vale para toda resolução futura que dependa da classe, o que permite
     * trocar implementações reais por mocks. Uma classe com parâmetros não injetáveis só pode
     * ser obtida se for registrada por aqui antes da primeira resolução.
     *
     * @param <T>        tipo da dependência
     * @param reference  classe usada como chave
     * @param dependency instância a ser devolvida para a classe
     */
    <T> void registerDependency(Class<T> reference, T dependency);
}
