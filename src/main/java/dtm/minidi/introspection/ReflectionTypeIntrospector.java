package dtm.minidi.introspection;

import dtm.minidi.annotations.MainConstructor;
import dtm.minidi.exceptions.NewInstanceException;
import lombok.NonNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Implementação padrão de {@link TypeIntrospector} baseada em reflexão.
 *
 * Ordem de escolha do construtor:
 * <ol>
 *   <li>o construtor anotado com {@link MainConstructor};</li>
 *   <li>o único construtor declarado;</li>
 *   <li>o construtor sem argumentos, se existir.</li>
 * </ol>
 */
@SuppressWarnings("unchecked")
public class ReflectionTypeIntrospector implements TypeIntrospector {

    private static final Set<Class<?>> VALUE_TYPES = Set.of(
            Object.class,
            String.class,
            CharSequence.class,
            Number.class,
            Boolean.class,
            Character.class,
            Void.class,
            Class.class
    );

    @Override
    public <T> ConstructorSignature<T> inspect(@NonNull Class<T> reference) throws NewInstanceException {
        validConcreteClass(reference);

        Constructor<T> constructor = getSelectedConstructor((Constructor<T>[]) reference.getDeclaredConstructors(), reference);
        try {
            if(!constructor.canAccess(null)){
                constructor.setAccessible(true);
            }
        } catch (InaccessibleObjectException | SecurityException e) {
            throw new NewInstanceException("Construtor inacessível para: " + reference.getName() + " ==> causa: " + e.getMessage(), reference, e);
        }

        Parameter[] parameters = constructor.getParameters();
        Type[] genericTypes = constructor.getGenericParameterTypes();
        List<ConstructorParameter> constructorParameters = new ArrayList<>(parameters.length);

        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            // classes internas não estáticas não expõem o parâmetro implícito em getGenericParameterTypes
            Type genericType = (genericTypes.length == parameters.length) ? genericTypes[i] : parameter.getParameterizedType();
            constructorParameters.add(new ConstructorParameter(
                    i,
                    parameter.getName(),
                    parameter.getType(),
                    genericType,
                    isResolvable(parameter.getType(), genericType)
            ));
        }

        return new ConstructorSignature<>(reference, constructor, constructorParameters);
    }

    private void validConcreteClass(Class<?> reference) {
        if(reference.isPrimitive() || reference.isArray() || reference.isEnum() || reference.isAnnotation()
                || reference.isInterface() || Modifier.isAbstract(reference.getModifiers())){
            throw new NewInstanceException("Registre uma classe concreta para: " + reference.getName(), reference);
        }
    }

    private <T> Constructor<T> getSelectedConstructor(Constructor<T>[] constructors, Class<T> clazz){
        if(constructors == null || constructors.length == 0) throw new NewInstanceException("construtor não encontrado para: "+clazz, clazz);

        List<Constructor<T>> mainConstructors = Arrays.stream(constructors)
                .filter(c -> c.isAnnotationPresent(MainConstructor.class))
                .toList();

        if(mainConstructors.size() > 1){
            throw new NewInstanceException("Mais de um construtor anotado com @MainConstructor em: " + clazz.getName(), clazz);
        }
        if(mainConstructors.size() == 1){
            return mainConstructors.get(0);
        }
        if(constructors.length == 1){
            return constructors[0];
        }

        return Arrays.stream(constructors)
                .filter(c -> c.getParameterCount() == 0)
                .findFirst()
                .orElseThrow(() -> new NewInstanceException(
                        "Construtores ambíguos em " + clazz.getName() + ": anote um deles com @MainConstructor",
                        clazz
                ));
    }

    private boolean isResolvable(Class<?> type, Type genericType){
        if(genericType instanceof TypeVariable<?>){
            return false;
        }
        final Class<?> rawType = (genericType instanceof ParameterizedType parameterizedType
                && parameterizedType.getRawType() instanceof Class<?> parameterizedRaw) ? parameterizedRaw : type;

        if(rawType.isPrimitive() || rawType.isArray() || rawType.isEnum() || rawType.isAnnotation()){
            return false;
        }
        return VALUE_TYPES.stream()
                .noneMatch(valueType -> valueType.equals(rawType) || (valueType != Object.class && valueType.isAssignableFrom(rawType)));
    }
}
