package max.chess.ai.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.util.function.Predicate;

/**
 * Threefold repetition is not part of {@link GameState}: rules engines expose it either as
 * {@code isThreefoldRepetition()} or, in older versions, {@code inThreefoldRepetition()}, or not at all.
 * The capability is resolved once per concrete class and cached.
 */
public final class RepetitionProbe {
    private static final Logger LOG = LoggerFactory.getLogger(RepetitionProbe.class);

    static final String CURRENT_NAME = "isThreefoldRepetition";
    static final String LEGACY_NAME = "inThreefoldRepetition";

    private static final Predicate<Object> NEVER_REPEATED = state -> false;

    private static final ClassValue<Predicate<Object>> PROBES = new ClassValue<>() {
        @Override
        protected Predicate<Object> computeValue(Class<?> type) {
            return resolve(type);
        }
    };

    private RepetitionProbe() {}

    public static boolean isThreefold(GameState state) {
        return PROBES.get(state.getClass()).test(state);
    }

    private static Predicate<Object> resolve(Class<?> type) {
        for (String name : new String[]{CURRENT_NAME, LEGACY_NAME}) {
            MethodHandle handle = findPredicate(type, name);
            if (handle != null) {
                LOG.debug("Repetition check for {} resolved to {}()", type.getName(), name);
                return state -> invoke(handle, state, type, name);
            }
        }
        LOG.debug("No repetition check on {}, positions are never treated as repeated", type.getName());
        return NEVER_REPEATED;
    }

    private static MethodHandle findPredicate(Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            if (method.getReturnType() != boolean.class) {
                return null;
            }
            method.setAccessible(true);
            return MethodHandles.lookup().unreflect(method)
                    .asType(MethodType.methodType(boolean.class, Object.class));
        } catch (NoSuchMethodException | IllegalAccessException | RuntimeException e) {
            return null;
        }
    }

    private static boolean invoke(MethodHandle handle, Object state, Class<?> type, String name) {
        try {
            return (boolean) handle.invokeExact(state);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            LOG.warn("{}.{}() failed, treating position as not repeated", type.getSimpleName(), name, t);
            return false;
        }
    }
}
