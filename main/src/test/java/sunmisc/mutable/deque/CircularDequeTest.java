package sunmisc.mutable.deque;

import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import sunmisc.mutable.scope.Scope;
import sunmisc.mutable.scope.ScopeViolationException;
import sunmisc.mutable.storage.Indirected;
import sunmisc.mutable.storage.Marshalled;
import sunmisc.mutable.storage.Marshaller;
import sunmisc.mutable.storage.Packed;
import sunmisc.mutable.storage.ReleaseException;
import sunmisc.mutable.storage.Storage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

public final class CircularDequeTest {

    @Test
    public void mixedEnds() {
        final CircularDeque<Integer> deque = new CircularDeque<>(Packed.of(int.class));
        deque.pushBack(1);
        deque.pushBack(2);
        deque.pushFront(0);
        MatcherAssert.assertThat(deque.popFront(), CoreMatchers.equalTo(Optional.of(0)));
        MatcherAssert.assertThat(deque.popFront(), CoreMatchers.equalTo(Optional.of(1)));
        MatcherAssert.assertThat(deque.popBack(), CoreMatchers.equalTo(Optional.of(2)));
        MatcherAssert.assertThat(deque.popFront(), CoreMatchers.equalTo(Optional.empty()));
    }

    @Test
    public void hundredElementsKeepOrder() {
        final CircularDeque<Integer> deque = new CircularDeque<>(Packed.of(int.class));
        for (int i = 0; i < 100; ++i) {
            deque.pushBack(i);
        }
        for (int i = 0; i < 100; ++i) {
            MatcherAssert.assertThat(
                    String.format("Element %s popped out of order", i),
                    deque.popFront(),
                    CoreMatchers.equalTo(Optional.of(i))
            );
        }
        MatcherAssert.assertThat(deque.isEmpty(), CoreMatchers.is(true));
    }

    @Test
    public void pushFrontThenPopBackReverses() {
        final CircularDeque<String> deque = new CircularDeque<>(Indirected.retaining());
        List.of("a", "b", "c").forEach(deque::pushFront);
        final List<String> popped = new ArrayList<>();
        deque.popBack().ifPresent(popped::add);
        deque.popBack().ifPresent(popped::add);
        deque.popBack().ifPresent(popped::add);
        MatcherAssert.assertThat(popped, CoreMatchers.equalTo(List.of("a", "b", "c")));
    }

    @Test
    public void emptyPopsDoNotMutate() {
        final CircularDeque<Long> deque = new CircularDeque<>(new Marshalled<>(Marshaller.LONG));
        for (int i = 0; i < 8; ++i) {
            MatcherAssert.assertThat(deque.popFront(), CoreMatchers.equalTo(Optional.empty()));
            MatcherAssert.assertThat(deque.popBack(), CoreMatchers.equalTo(Optional.empty()));
            MatcherAssert.assertThat(deque.peekFront(), CoreMatchers.equalTo(Optional.empty()));
        }
        MatcherAssert.assertThat(deque.size(), CoreMatchers.equalTo(0));
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(0));
    }

    @Test
    public void firstPushAllocatesMinimum() {
        final CircularDeque<Integer> deque = new CircularDeque<>(Packed.of(int.class), 5);
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(0));
        deque.pushFront(7);
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(8));
        MatcherAssert.assertThat(deque.peekBack(), CoreMatchers.equalTo(Optional.of(7)));
    }

    @Test
    public void wrapAroundSurvivesGrowth() {
        final CircularDeque<Integer> deque = new CircularDeque<>(Packed.of(int.class));
        deque.pushBack(2);
        deque.pushBack(3);
        deque.pushFront(1);
        deque.pushFront(0);
        // head has wrapped to the end of the buffer, the next push grows it
        deque.pushBack(4);
        final List<Integer> seen = new ArrayList<>();
        deque.forEach(seen::add);
        MatcherAssert.assertThat(seen, CoreMatchers.equalTo(List.of(0, 1, 2, 3, 4)));
        MatcherAssert.assertThat(deque.get(4), CoreMatchers.equalTo(4));
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(8));
    }

    @Test
    public void getOutsideRangeFails() {
        final CircularDeque<Integer> deque = new CircularDeque<>(Packed.of(int.class));
        deque.pushBack(1);
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> deque.get(1));
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> deque.get(-1));
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 7, 42, 1024})
    public void matchesReferenceModel(final long seed) {
        final Random random = new Random(seed);
        final CircularDeque<Integer> deque = new CircularDeque<>(Packed.of(int.class));
        final Deque<Integer> model = new ArrayDeque<>();
        for (int op = 0; op < 10_000; ++op) {
            final int value = random.nextInt();
            switch (random.nextInt(5)) {
                case 0 -> {
                    deque.pushFront(value);
                    model.addFirst(value);
                }
                case 1, 2 -> {
                    deque.pushBack(value);
                    model.addLast(value);
                }
                case 3 -> MatcherAssert.assertThat(
                        deque.popFront(),
                        CoreMatchers.equalTo(Optional.ofNullable(model.pollFirst()))
                );
                default -> MatcherAssert.assertThat(
                        deque.popBack(),
                        CoreMatchers.equalTo(Optional.ofNullable(model.pollLast()))
                );
            }
            assertCapacity(deque);
            MatcherAssert.assertThat(deque.size(), CoreMatchers.equalTo(model.size()));
        }
        final List<Integer> rest = new ArrayList<>();
        deque.iterator().forEachRemaining(rest::add);
        MatcherAssert.assertThat(rest, CoreMatchers.equalTo(new ArrayList<>(model)));
    }

    @Test
    public void shrinksButNotBelowMinimum() {
        final CircularDeque<Integer> deque = new CircularDeque<>(Packed.of(int.class), 16);
        for (int i = 0; i < 1000; ++i) {
            deque.pushBack(i);
        }
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(1024));
        for (int i = 0; i < 1000; ++i) {
            deque.popFront();
            assertCapacity(deque);
        }
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(16));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 100, 1000, 100_000})
    public void pushCopiesAreLinear(final int count) {
        final CountingStorage<Integer> storage = new CountingStorage<>(Packed.of(int.class));
        final CircularDeque<Integer> deque = new CircularDeque<>(storage);
        for (int i = 0; i < count; ++i) {
            if ((i & 1) == 0) {
                deque.pushBack(i);
            } else {
                deque.pushFront(i);
            }
        }
        final int copies = storage.stores() - count;
        MatcherAssert.assertThat(
                String.format("%s copies for %s pushes", copies, count),
                copies <= 2 * count,
                CoreMatchers.is(true)
        );
        // the empty buffer, then one per doubling
        final int allocations = storage.allocations();
        MatcherAssert.assertThat(
                String.format("%s allocations for %s pushes", allocations, count),
                allocations <= 2 + Integer.SIZE - Integer.numberOfLeadingZeros(count),
                CoreMatchers.is(true)
        );
    }

    @Test
    public void failedGrowthKeepsState() {
        final CountingStorage<Integer> storage = new CountingStorage<>(Packed.of(int.class), 8);
        final CircularDeque<Integer> deque = new CircularDeque<>(storage);
        for (int i = 0; i < 8; ++i) {
            deque.pushFront(i);
        }
        Assertions.assertThrows(OutOfMemoryError.class, () -> deque.pushBack(8));
        MatcherAssert.assertThat(deque.size(), CoreMatchers.equalTo(8));
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(8));
        for (int i = 7; i >= 0; --i) {
            MatcherAssert.assertThat(deque.popFront(), CoreMatchers.equalTo(Optional.of(i)));
        }
    }

    @Test
    public void failedShrinkKeepsPoppedElement() {
        final CountingStorage<Integer> storage = new CountingStorage<>(Packed.of(int.class));
        final CircularDeque<Integer> deque = new CircularDeque<>(storage);
        for (int i = 0; i <= 8; ++i) {
            deque.pushBack(i);
        }
        for (int i = 0; i < 4; ++i) {
            deque.popFront();
        }
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(16));
        storage.limit(0);
        MatcherAssert.assertThat(deque.popBack(), CoreMatchers.equalTo(Optional.of(8)));
        MatcherAssert.assertThat(deque.size(), CoreMatchers.equalTo(4));
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(16));
        final List<Integer> rest = new ArrayList<>();
        deque.forEach(rest::add);
        MatcherAssert.assertThat(rest, CoreMatchers.equalTo(List.of(4, 5, 6, 7)));

        storage.limit(Storage.MAXIMUM_CAPACITY);
        MatcherAssert.assertThat(deque.popBack(), CoreMatchers.equalTo(Optional.of(7)));
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(8));
        assertCapacity(deque);
    }

    @Test
    public void failingReleaseStillEmptiesDeque() {
        final Resource ok = new Resource(false), broken = new Resource(true),
                last = new Resource(false);
        final CircularDeque<Resource> deque = new CircularDeque<>(Indirected.closing());
        deque.pushBack(ok);
        deque.pushBack(broken);
        deque.pushBack(last);
        Assertions.assertThrows(ReleaseException.class, deque::clear);
        MatcherAssert.assertThat(deque.size(), CoreMatchers.equalTo(0));
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(0));
        MatcherAssert.assertThat(deque.popFront(), CoreMatchers.equalTo(Optional.empty()));
        MatcherAssert.assertThat(deque.origin().exists(), CoreMatchers.is(false));
        MatcherAssert.assertThat(ok.closed, CoreMatchers.is(true));
        MatcherAssert.assertThat(last.closed, CoreMatchers.is(true));
        deque.pushBack(new Resource(false));
        MatcherAssert.assertThat(deque.size(), CoreMatchers.equalTo(1));
    }

    @Test
    public void scopeCloseReleasesElements() {
        final Resource held = new Resource(false), popped = new Resource(false);
        final CircularDeque<Resource> deque;
        try (Scope ignored = Scope.open()) {
            deque = new CircularDeque<>(Indirected.closing());
            deque.pushBack(held);
            deque.pushBack(popped);
            deque.popBack();
        }
        MatcherAssert.assertThat(held.closed, CoreMatchers.is(true));
        MatcherAssert.assertThat(popped.closed, CoreMatchers.is(false));
    }

    @Test
    public void indirectedPayloadsAreReleasedOnce() {
        final Set<Payload> live = new HashSet<>();
        final List<Payload> released = new ArrayList<>();
        final CircularDeque<Payload> deque = new CircularDeque<>(
                new Indirected<Payload>(p -> {
                    MatcherAssert.assertThat(
                            "Payload released twice",
                            live.remove(p),
                            CoreMatchers.is(true)
                    );
                    released.add(p);
                })
        );
        for (int i = 0; i < 64; ++i) {
            final Payload p = new Payload(i);
            live.add(p);
            deque.pushBack(p);
        }
        // popped payloads belong to the caller, relocations move them
        for (int i = 0; i < 60; ++i) {
            live.remove(deque.popFront().orElseThrow());
        }
        MatcherAssert.assertThat(released.isEmpty(), CoreMatchers.is(true));
        deque.clear();
        MatcherAssert.assertThat(released.size(), CoreMatchers.equalTo(4));
        MatcherAssert.assertThat(live.isEmpty(), CoreMatchers.is(true));
        MatcherAssert.assertThat(deque.capacity(), CoreMatchers.equalTo(0));
    }

    @Test
    public void rejectNulls() {
        final CircularDeque<String> deque = new CircularDeque<>(Indirected.retaining());
        Assertions.assertThrows(NullPointerException.class, () -> deque.pushBack(null));
        MatcherAssert.assertThat(deque.size(), CoreMatchers.equalTo(0));
    }

    @Test
    public void illegalMinimumCapacity() {
        final Storage<Integer> storage = Packed.of(int.class);
        Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> new CircularDeque<>(storage, 0)
        );
    }

    @Test
    public void confinedToScope() {
        final CircularDeque<Integer> deque;
        try (Scope scope = Scope.open()) {
            deque = new CircularDeque<>(Packed.of(int.class));
            deque.pushBack(1);
        }
        Assertions.assertThrows(ScopeViolationException.class, () -> deque.pushBack(2));
        Assertions.assertThrows(ScopeViolationException.class, deque::popFront);
    }

    private static void assertCapacity(final CircularDeque<?> deque) {
        final int capacity = deque.capacity();
        MatcherAssert.assertThat(
                String.format("size %s exceeds capacity %s", deque.size(), capacity),
                deque.size() <= capacity,
                CoreMatchers.is(true)
        );
        MatcherAssert.assertThat(
                String.format("capacity %s is not a power of two", capacity),
                Integer.bitCount(capacity) <= 1,
                CoreMatchers.is(true)
        );
        MatcherAssert.assertThat(
                String.format("capacity %s fell below the minimum", capacity),
                capacity == 0 || capacity >= deque.minCapacity(),
                CoreMatchers.is(true)
        );
    }

    private record Payload(int id) { }

    private static final class Resource implements AutoCloseable {
        private final boolean broken;
        private boolean closed;

        Resource(final boolean broken) {
            this.broken = broken;
        }

        @Override
        public void close() throws Exception {
            if (this.broken) {
                throw new Exception("Broken resource");
            }
            this.closed = true;
        }
    }
}
