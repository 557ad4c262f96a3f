package dtm.minidi.storage;

import dtm.minidi.prototypes.Dependency;
import lombok.*;

@Getter
@ToString
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
public class DependencyObject extends Dependency {
    @NonNull
    private final Class<?> dependencyClass;

    @NonNull
    @ToString.Exclude
    private final Object dependency;

    private final boolean manualRegistration;
}
