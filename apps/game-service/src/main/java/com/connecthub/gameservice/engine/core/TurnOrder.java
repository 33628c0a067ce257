package com.connecthub.gameservice.engine.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * 行棋顺序：开局时洗牌一次，之后按固定顺序循环（取模游标），整盘不再重排。
 * Random 由外部传入，测试里给固定种子即可复现。
 */
public final class TurnOrder<E> {

    private final List<E> order;
    private int cursor = 0;

    public TurnOrder(List<? extends E> participants, Random random) {
        Objects.requireNonNull(random, "random");
        if (participants == null || participants.isEmpty()) {
            throw new IllegalArgumentException("TURN_ORDER_EMPTY");
        }
        List<E> shuffled = new ArrayList<>(participants);
        Collections.shuffle(shuffled, random);
        this.order = Collections.unmodifiableList(shuffled);
    }

    /** 返回当前轮到的参与者，并把游标推进到下一位 */
    public E next() {
        E current = order.get(cursor);
        cursor = (cursor + 1) % order.size();
        return current;
    }

    /** 只看当前轮到谁，不推进 */
    public E peek() {
        return order.get(cursor);
    }

    public int size() {
        return order.size();
    }

    /** 本盘的固定顺序（只读） */
    public List<E> order() {
        return order;
    }
}
