package com.xinyue.router.core;

import com.lmax.disruptor.EventFactory;
import com.xinyue.router.common.CoreEvent;

public final class CoreEventFactory implements EventFactory<CoreEvent> {
    @Override
    public CoreEvent newInstance() {
        return new CoreEvent();
    }
}
