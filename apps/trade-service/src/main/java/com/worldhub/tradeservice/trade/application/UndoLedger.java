package com.worldhub.tradeservice.trade.application;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

/**
 * 撤销账本
 * -------------------------------------------------------
 * 存储层没有跨 key 事务，交换时每完成一步就登记它的逆操作；
 * 后续阶段失败时按登记的相反顺序逐条撤销。
 * - 撤销失败不会重试（不做"回滚的回滚"），只收集起来交给上层做人工对账；
 * - 某一步撤销失败不影响其余步骤继续撤销。
 */
@Slf4j
public class UndoLedger {

    /**
     * 逆操作：返回 false 或抛出异常都视为撤销失败。
     */
    @FunctionalInterface
    public interface Reversal {
        boolean revert();
    }

    /**
     * 已完成的一步及其逆操作。
     */
    public record Step(String description, Reversal reversal) {
    }

    private final LinkedList<Step> steps = new LinkedList<>();

    /** 登记一步已完成的操作 */
    public void record(String description, Reversal reversal) {
        steps.addLast(new Step(description, reversal));
    }

    public int size() {
        return steps.size();
    }

    /**
     * 逆序撤销全部已登记步骤，完成后账本清空。
     * @return 未能撤销的步骤描述（按原执行顺序）；空列表表示全部撤销成功
     */
    public List<String> rollback() {
        List<String> failed = new ArrayList<>();
        Iterator<Step> it = steps.descendingIterator();
        while (it.hasNext()) {
            Step step = it.next();
            boolean ok;
            try {
                ok = step.reversal().revert();
            } catch (RuntimeException e) {
                log.error("撤销步骤抛出异常: step={}", step.description(), e);
                ok = false;
            }
            if (!ok) {
                log.error("撤销步骤失败: step={}", step.description());
                failed.add(step.description());
            }
        }
        steps.clear();
        Collections.reverse(failed);
        return failed;
    }
}
