package com.govsandbox.gate;

/**
 * Operator halt flag polled before every atomic unit of work. Any asserted signal stops new transactions.
 */
@FunctionalInterface
public interface HaltSignal {

    boolean isHalted();
}
