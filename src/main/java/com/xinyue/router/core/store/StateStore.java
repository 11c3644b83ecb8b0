package com.xinyue.router.core.store;

public interface StateStore {

    /**
     * 读取最近一次保存的状态，没有时返回 {@link StateSnapshot#empty()}。
     *
     * @throws StateStoreException 文件存在但无法读取或解析
     */
    StateSnapshot load();

    /**
     * @throws StateStoreException 写入失败，此时旧文件保持不变
     */
    void save(StateSnapshot snapshot);
}
