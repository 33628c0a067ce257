package com.connecthub.gameservice.engine.core;

/**
 * 回合制参与者抽象（玩家/AI 共用）。
 * - V：交给参与者的只读局面视图；
 * - C：参与者返回的指令；
 * - R：终局后回调的结果。
 * 引擎只通过这两个方法与参与者交互，具体实现（命令行、随机、远程）对引擎透明。
 */
public interface Participant<V, C, R> {

    /**
     * 根据当前局面选择一条指令。
     * 同步调用，允许阻塞（例如等待命令行输入），引擎不设超时。
     */
    C selectAction(V view);

    /** 终局通知，返回值被忽略。 */
    void notifyOutcome(R outcome);
}
