package dtm.minidi.exceptions;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class CircularDependencyException extends DependencyContainerException {
    private final List<Class<?>> cycle;

    public CircularDependencyException(List<Class<?>> cycle) {
        super("Dependência circular detectada: " + cycle.stream()
                .map(Class::getName)
                .collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public Class<?> getReferenceClass() {
        return cycle.get(cycle.size() - 1);
    }
}
