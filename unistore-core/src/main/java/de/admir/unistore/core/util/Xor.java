package de.admir.unistore.core.util;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Either a failure on the left or a value on the right. Storage operations report every outcome through this type
 * rather than by throwing.
 */
public abstract class Xor<L, R> {

    public static <L, R> Xor<L, R> left(L left) {
        return new Xor.Left<>(left);
    }

    public static <L, R> Xor<L, R> right(R right) {
        return new Xor.Right<>(right);
    }

    public static <R> Xor<Exception, R> catchNonFatal(Callable<R> callable) {
        try {
            return Xor.right(callable.call());
        } catch (Exception e) {
            return Xor.left(e);
        }
    }

    /**
     * Same as {@link #catchNonFatal(Callable)} for calls whose only result is completing.
     */
    public static Xor<Exception, Void> catchNonFatalRun(ThrowingRunnable runnable) {
        try {
            runnable.run();
            return Xor.right(null);
        } catch (Exception e) {
            return Xor.left(e);
        }
    }

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static <L, R> Xor<L, R> fromOptional(Optional<R> optional, Supplier<L> elseValueSupplier) {
        return optional.isPresent() ? Xor.right(optional.get()) : Xor.left(elseValueSupplier.get());
    }

    public abstract <T> T fold(Function<L, T> transformLeft, Function<R, T> transformRight);

    public <T, U> Xor<T, U> map(Function<L, T> transformLeft, Function<R, U> transformRight) {
        return fold(left -> Xor.left(transformLeft.apply(left)), right -> Xor.right(transformRight.apply(right)));
    }

    public <U> Xor<L, U> flatMapRight(Function<R, Xor<L, U>> transformRight) {
        return fold(Xor::left, transformRight);
    }

    public <T> Xor<T, R> flatMapLeft(Function<L, Xor<T, R>> transformLeft) {
        return fold(transformLeft, Xor::right);
    }

    public <U> Xor<L, U> mapRight(Function<R, U> transformRight) {
        return this.map(left -> left, transformRight);
    }

    public <U> Xor<U, R> mapLeft(Function<L, U> transformLeft) {
        return this.map(transformLeft, right -> right);
    }

    public Xor<L, R> peekLeft(Consumer<L> consumer) {
        if (isLeft())
            consumer.accept(getLeft());
        return this;
    }

    public Xor<L, R> peekRight(Consumer<R> consumer) {
        if (isRight())
            consumer.accept(getRight());
        return this;
    }

    public R getOrElse(R other) {
        return isRight() ? getRight() : other;
    }

    public Optional<R> toOptional() {
        return isRight() ? Optional.ofNullable(getRight()) : Optional.empty();
    }

    public abstract L getLeft();

    public abstract R getRight();

    public abstract boolean isLeft();

    public boolean isRight() {
        return !isLeft();
    }

    @FunctionalInterface
    public interface ThrowingRunnable {
        void run() throws Exception;
    }

    private static final class Left<L, R> extends Xor<L, R> {
        private final L leftValue;

        private Left(L left) {
            this.leftValue = left;
        }

        @Override
        public L getLeft() {
            return leftValue;
        }

        @Override
        public R getRight() {
            throw new NoSuchElementException("Tried to getRight from a Left");
        }

        @Override
        public boolean isLeft() {
            return true;
        }

        @Override
        public <T> T fold(Function<L, T> transformLeft, Function<R, T> transformRight) {
            return transformLeft.apply(leftValue);
        }

        @Override
        public String toString() {
            return "Left(" + leftValue + ")";
        }
    }

    private static final class Right<L, R> extends Xor<L, R> {
        private final R rightValue;

        private Right(R right) {
            this.rightValue = right;
        }

        @Override
        public L getLeft() {
            throw new NoSuchElementException("Tried to getLeft from a Right");
        }

        @Override
        public R getRight() {
            return rightValue;
        }

        @Override
        public boolean isLeft() {
            return false;
        }

        @Override
        public <T> T fold(Function<L, T> transformLeft, Function<R, T> transformRight) {
            return transformRight.apply(rightValue);
        }

        @Override
        public String toString() {
            return "Right(" + rightValue + ")";
        }
    }
}
