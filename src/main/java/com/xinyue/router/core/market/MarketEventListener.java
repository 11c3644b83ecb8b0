package com.xinyue.router.core.market;

/**
 * 聚合引擎输出的派生事件，由订阅中心消费。
 * 回调发生在聚合引擎的消费线程上，实现方不得阻塞。
 */
public interface MarketEventListener {

    /** BestTouchUpdated */
    void onBestTouch(BestTouch touch);

    /** TradePassThrough */
    void onTrade(TradePrint trade);

    /** KlineUpdated / KlineClosed，由 {@link KlineBucket#closed()} 区分 */
    void onKline(KlineBucket bucket);

    /** EwmaUpdated */
    void onEwma(EwmaUpdate update);

    MarketEventListener NOOP = new MarketEventListener() {
        @Override
        public void onBestTouch(BestTouch touch) {
        }

        @Override
        public void onTrade(TradePrint trade) {
        }

        @Override
        public void onKline(KlineBucket bucket) {
        }

        @Override
        public void onEwma(EwmaUpdate update) {
        }
    };
}
