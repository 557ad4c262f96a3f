package dtm.minidi.core;

/**
 * Interface principal para um contêiner de dependências.
 *
 * Cada contêiner mantém no máximo uma instância por classe. As instâncias são criadas
 * sob demanda, resolvendo recursivamente os parâmetros do construtor, ou registradas
 * manualmente para substituir a construção automática.
 *
 * Estende as interfaces:
 * <ul>
 *   <li>{@link DependencyContainerGetter} - para obtenção de dependências;</li>
 *   <li>{@link DependencyContainerRegistor} - para registro de dependências;</li>
 *   <li>{@link DependencyContainerConfigurator} - para configuração do contêiner.</li>
 * </ul>
 */
public interface DependencyContainer extends
        DependencyContainerGetter,
        DependencyContainerRegistor,
        DependencyContainerConfigurator
{
}
