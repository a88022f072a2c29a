package sunmisc.mutable.capability;

@FunctionalInterface
public interface PushFront<E> {

    void pushFront(E element);
}
