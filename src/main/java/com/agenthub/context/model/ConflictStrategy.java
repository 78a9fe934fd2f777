package com.agenthub.context.model;

/**
 * 写冲突处理策略
 */
public enum ConflictStrategy {

    /** 总是接受新值 */
    LAST_WRITER_WINS,
    /** 乐观锁：调用方期望版本必须等于当前版本 */
    VERSION_BASED,
    /** 写入方优先级不低于上一写入方时接受 */
    AGENT_PRIORITY,
    /** 两侧均为 Map 时浅合并，否则退化为 LAST_WRITER_WINS */
    MERGE
}
