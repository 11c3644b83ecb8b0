package com.xinyue.router.web.service;

import com.xinyue.router.core.store.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 用户服务。
 * 管理注册和密码校验，密码以 PBKDF2-SHA256 加盐哈希保存（base64(salt + digest)）。
 */
public final class UserService {

    private static final Logger LOG = LoggerFactory.getLogger(UserService.class);

    private static final int ITERATIONS = 120_000;
    private static final int SALT_BYTES = 16;

    private final PasswordEncoder passwordEncoder = newEncoder();
    private final ConcurrentHashMap<String, StateSnapshot.UserRecord> users = new ConcurrentHashMap<>();

    /**
     * 注册新用户。
     *
     * @throws IllegalArgumentException 用户名少于 3 个字符、密码少于 6 个字符，或用户名已存在
     */
    public void register(String username, String password) {
        if (username == null || username.trim().length() < 3) {
            throw new IllegalArgumentException("用户名至少 3 个字符");
        }
        if (password == null || password.length() < 6) {
            throw new IllegalArgumentException("密码至少 6 个字符");
        }
        String name = username.trim();
        StateSnapshot.UserRecord record = new StateSnapshot.UserRecord(name, hash(password), System.currentTimeMillis());
        if (users.putIfAbsent(name, record) != null) {
            throw new IllegalArgumentException("用户名已存在: " + name);
        }
        LOG.info("新用户注册: username={}", name);
    }

    /**
     * @return 用户名和密码匹配时返回 true
     */
    public boolean authenticate(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        StateSnapshot.UserRecord record = users.get(username.trim());
        if (record == null) {
            LOG.warn("用户不存在: username={}", username);
            return false;
        }
        boolean ok = verify(password, record.passwordHash());
        if (!ok) {
            LOG.warn("密码错误: username={}", username);
        }
        return ok;
    }

    public boolean exists(String username) {
        return users.containsKey(username);
    }

    public List<StateSnapshot.UserRecord> export() {
        List<StateSnapshot.UserRecord> list = new ArrayList<>(users.values());
        list.sort(Comparator.comparing(StateSnapshot.UserRecord::username));
        return list;
    }

    public void restore(List<StateSnapshot.UserRecord> records) {
        if (records == null) {
            return;
        }
        for (StateSnapshot.UserRecord record : records) {
            users.put(record.username(), record);
        }
    }

    String hash(String password) {
        return passwordEncoder.encode(password);
    }

    boolean verify(String password, String stored) {
        try {
            return passwordEncoder.matches(password, stored);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            // 不是本服务生成的哈希
            LOG.warn("密码哈希格式错误: {}", e.getMessage());
            return false;
        }
    }

    /**
     * PBKDF2-SHA256，16 字节随机盐，无全局 secret，输出 base64(salt + digest)。
     */
    private static PasswordEncoder newEncoder() {
        Pbkdf2PasswordEncoder encoder = new Pbkdf2PasswordEncoder("", SALT_BYTES, ITERATIONS,
                Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);
        encoder.setEncodeHashAsBase64(true);
        return encoder;
    }
}
