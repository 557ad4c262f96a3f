package dtm.minidi.core;

import dtm.minidi.introspection.TypeIntrospector;

/**
 * Interface para configuração do comportamento do contêiner de dependências.
 */
public interface DependencyContainerConfigurator {

    /**
     * Define o mecanismo usado para ler a assinatura dos construtores.
     * Passar {@code null} restaura o introspector padrão baseado em reflexão.
     *
     * @param typeIntrospector introspector a ser usado nas próximas resoluções
     */
    void setTypeIntrospector(TypeIntrospector typeIntrospector);

    TypeIntrospector getTypeIntrospector();

    /**
     * Habilita o cache das assinaturas de construtor lidas pelo introspector.
     */
    void enableIntrospectionCache();
    /**
     * Desabilita o cache das assinaturas de construtor.
     */
    void disableIntrospectionCache();

    boolean isIntrospectionCacheEnabled();
}
