package dtm.minidi.prototypes;

/**
 * Representa uma entrada registrada no contêiner de injeção.
 * <p>
 * Permite inspecionar o "bean bruto" mantido pelo contêiner:
 * <ul>
 *     <li>A classe usada como chave no registro</li>
 *     <li>A instância única associada a essa classe</li>
 *     <li>Se a instância foi registrada manualmente ou construída pelo contêiner</li>
 * </ul>
 */
public abstract class Dependency {
    public abstract Class<?> getDependencyClass();
    public abstract Object getDependency();
    public abstract boolean isManualRegistration();
}
