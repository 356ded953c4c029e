package util;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * FIFO 工作表，每个元素一生只能入队一次，出队之后也不会再次入队。
 */
public class UniqueQueue<T> {
    private final ArrayDeque<T> queue = new ArrayDeque<>();
    private final Set<T> seen = new HashSet<>();

    /**
     * @return 第一次见到该元素时返回 true
     */
    public boolean push(T t) {
        if (!seen.add(t)) {
            return false;
        }
        queue.add(t);
        return true;
    }

    public T pop() {
        return queue.poll();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /* 还在队列里的元素个数 */
    public int size() {
        return queue.size();
    }

    public boolean hasSeen(T t) {
        return seen.contains(t);
    }
}
