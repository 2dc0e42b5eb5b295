package locaposty.worker.testing;

import java.lang.reflect.Field;
import java.lang.reflect.Method;

/**
 * Wires package-private {@code @Inject}/{@code @ConfigProperty} fields of beans built outside the container.
 */
public final class TestInjection {

    private TestInjection() {
    }

    public static <T> T inject(T target, String fieldName, Object value) {
        Field field = findField(target.getClass(), fieldName);
        try {
            field.setAccessible(true);
            field.set(target, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot set " + fieldName + " on " + target.getClass().getSimpleName(), e);
        }
        return target;
    }

    /**
     * Invokes a no-arg lifecycle method such as a {@code @PostConstruct init()}.
     */
    public static void invoke(Object target, String methodName) {
        try {
            Method method = target.getClass().getDeclaredMethod(methodName);
            method.setAccessible(true);
            method.invoke(target);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot invoke " + methodName + " on " + target.getClass().getSimpleName(),
                    e);
        }
    }

    private static Field findField(Class<?> type, String fieldName) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            try {
                return current.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                // keep walking up
            }
        }
        throw new IllegalArgumentException("No field " + fieldName + " on " + type.getName());
    }
}
