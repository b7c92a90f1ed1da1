package com.milestake.blockchain.contract;

@FunctionalInterface
public interface LedgerEventListener {

    void onEvent(LedgerEvent event);
}
