package sunmisc.mutable.capability;

@FunctionalInterface
public interface PushBack<E> {

    void pushBack(E element);
}
