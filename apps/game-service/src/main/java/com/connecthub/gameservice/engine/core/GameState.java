package com.connecthub.gameservice.engine.core;

/**
 * 游戏状态接口。
 * - exposeView：给参与者的只读快照，每次调用都返回新对象，不能借此修改实盘；
 * - copy：深拷贝，便于参与者/测试在副本上推演而不污染实盘。
 */
public interface GameState<V> {

    V exposeView();

    GameState<V> copy();
}
