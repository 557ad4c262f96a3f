package dtm.minidi.storage;

import dtm.minidi.core.DependencyContainer;
import dtm.minidi.exceptions.CircularDependencyException;
import dtm.minidi.exceptions.NewInstanceException;
import dtm.minidi.exceptions.UnresolvableParameterException;
import dtm.minidi.introspection.CachedTypeIntrospector;
import dtm.minidi.introspection.ConstructorParameter;
import dtm.minidi.introspection.ConstructorSignature;
import dtm.minidi.introspection.ReflectionTypeIntrospector;
import dtm.minidi.introspection.TypeIntrospector;
import dtm.minidi.prototypes.Dependency;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationTargetException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@SuppressWarnings("unchecked")
public class DependencyContainerStorage implements DependencyContainer {

    private final Map<Class<?>, Dependency> dependencyContainer;
    private final AtomicReference<TypeIntrospector> typeIntrospector;

    public DependencyContainerStorage() {
        this(new ReflectionTypeIntrospector());
    }

    public DependencyContainerStorage(@NonNull TypeIntrospector typeIntrospector) {
        this.dependencyContainer = new ConcurrentHashMap<>();
        this.typeIntrospector = new AtomicReference<>(typeIntrospector);
    }

    @Override
    public <T> T getDependency(@NonNull Class<T> reference) {
        return (T) resolve(reference, new LinkedHashSet<>());
    }

    @Override
    public <T> void registerDependency(@NonNull Class<T> reference, @NonNull T dependency) {
        registerObject(reference, dependency, true);
    }

    @Override
    public boolean isRegistered(@NonNull Class<?> reference) {
        return dependencyContainer.containsKey(reference);
    }

    @Override
    public List<Dependency> getRegisteredDependencies() {
        return List.copyOf(dependencyContainer.values());
    }

    @Override
    public Set<Class<?>> getRegisteredClasses() {
        return Set.copyOf(dependencyContainer.keySet());
    }

    @Override
    public void setTypeIntrospector(TypeIntrospector typeIntrospector) {
        TypeIntrospector introspector = (typeIntrospector != null) ? typeIntrospector : new ReflectionTypeIntrospector();
        this.typeIntrospector.set(isIntrospectionCacheEnabled() && !(introspector instanceof CachedTypeIntrospector)
                ? new CachedTypeIntrospector(introspector)
                : introspector);
    }

    @Override
    public TypeIntrospector getTypeIntrospector() {
        return typeIntrospector.get();
    }

    @Override
    public void enableIntrospectionCache() {
        typeIntrospector.updateAndGet(current -> (current instanceof CachedTypeIntrospector)
                ? current
                : new CachedTypeIntrospector(current));
    }

    @Override
    public void disableIntrospectionCache() {
        typeIntrospector.updateAndGet(current -> (current instanceof CachedTypeIntrospector cached)
                ? cached.getDelegate()
                : current);
    }

    @Override
    public boolean isIntrospectionCacheEnabled() {
        return typeIntrospector.get() instanceof CachedTypeIntrospector;
    }

    private Object resolve(Class<?> reference, final Set<Class<?>> resolvingClasses) {
        Dependency registered = dependencyContainer.get(reference);
        if(registered != null){
            return registered.getDependency();
        }

        validResolution(reference, resolvingClasses);
        try {
            final ConstructorSignature<?> signature = typeIntrospector.get().inspect(reference);
            final Object[] args = new Object[signature.getParameters().size()];

            for (ConstructorParameter parameter : signature.getParameters()) {
                if(!parameter.isResolvable()){
                    log.debug("Parâmetro {} ({}) de {} não é injetável", parameter.getIndex(), parameter.getType().getName(), reference.getName());
                    throw new UnresolvableParameterException(reference, parameter.getIndex(), parameter.getName(), parameter.getType());
                }
                args[parameter.getIndex()] = resolve(parameter.getType(), resolvingClasses);
            }

            Object instance = createObject(signature, args);
            registerObject(reference, instance, false);
            return instance;
        } finally {
            resolvingClasses.remove(reference);
        }
    }

    private void validResolution(Class<?> reference, final Set<Class<?>> resolvingClasses) {
        if (resolvingClasses.contains(reference)) {
            List<Class<?>> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (Class<?> resolving : resolvingClasses) {
                inCycle = inCycle || resolving.equals(reference);
                if(inCycle) cycle.add(resolving);
            }
            cycle.add(reference);
            log.debug("Ciclo encontrado ao resolver {}: {}", reference.getName(), cycle);
            throw new CircularDependencyException(cycle);
        }
        resolvingClasses.add(reference);
    }

    private Object createObject(ConstructorSignature<?> signature, Object[] args) {
        final Class<?> clazz = signature.getReferenceClass();
        try {
            return signature.getConstructor().newInstance(args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) throw runtimeException;
            if (cause instanceof Error error) throw error;

            log.error("Erro ao criar instância para a classe: {}", clazz.getName(), cause);
            throw new NewInstanceException("Erro ao criar instância "+clazz+" ==> cause: "+cause.getMessage(), clazz, cause);
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            log.error("Erro ao criar instância para a classe: {}", clazz.getName(), e);
            throw new NewInstanceException("Erro ao criar instância "+clazz+" ==> cause: "+e.getMessage(), clazz, e);
        }
    }

    private void registerObject(Class<?> reference, Object instance, boolean manual) {
        DependencyObject dependencyObject = DependencyObject.builder()
                .dependencyClass(reference)
                .dependency(instance)
                .manualRegistration(manual)
                .build();

        Dependency previous = dependencyContainer.put(reference, dependencyObject);
        if(previous != null){
            log.debug("Instância de {} substituída", reference.getName());
        }else{
            log.debug("Dependência registrada: {} (manual={})", reference.getName(), manual);
        }
    }
}
