package work.lcod.docpath.walk;

import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import work.lcod.docpath.path.Path;

/**
 * Per-call configuration for {@link DocumentWalker#walk(Object, Path, WalkArgs)}.
 *
 * @param matchAll collect every resolution of {@code -} segments instead of stopping at the first
 * @param matchFunction called with the resolved value and its concrete path; {@code false} turns
 *     the resolution into a "not found"
 * @param mutateFunction replaces the resolved value; returning {@code null} removes it
 * @param notFoundFunction receives the path walked up to, and including, the segment that failed
 */
public record WalkArgs(
    boolean matchAll,
    BiPredicate<Object, Path> matchFunction,
    UnaryOperator<Object> mutateFunction,
    Consumer<Path> notFoundFunction
) {
    private static final WalkArgs NONE = new WalkArgs(false, null, null, null);

    public static WalkArgs none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean mutates() {
        return mutateFunction != null;
    }

    public static final class Builder {
        private boolean matchAll;
        private BiPredicate<Object, Path> matchFunction;
        private UnaryOperator<Object> mutateFunction;
        private Consumer<Path> notFoundFunction;

        public Builder matchAll(boolean matchAll) {
            this.matchAll = matchAll;
            return this;
        }

        public Builder matchFunction(BiPredicate<Object, Path> matchFunction) {
            this.matchFunction = matchFunction;
            return this;
        }

        public Builder mutateFunction(UnaryOperator<Object> mutateFunction) {
            this.mutateFunction = mutateFunction;
            return this;
        }

        public Builder notFoundFunction(Consumer<Path> notFoundFunction) {
            this.notFoundFunction = notFoundFunction;
            return this;
        }

        public WalkArgs build() {
            return new WalkArgs(matchAll, matchFunction, mutateFunction, notFoundFunction);
        }
    }
}
