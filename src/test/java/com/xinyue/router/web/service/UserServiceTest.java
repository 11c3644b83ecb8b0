package com.xinyue.router.web.service;

import com.xinyue.router.core.store.StateSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("用户服务测试")
class UserServiceTest {

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService();
    }

    @Test
    @DisplayName("注册后可以用正确密码登录")
    void testRegisterAndAuthenticate() {
        userService.register("trader1", "secret1");

        assertTrue(userService.exists("trader1"));
        assertTrue(userService.authenticate("trader1", "secret1"));
        assertFalse(userService.authenticate("trader1", "wrong-pass"));
        assertFalse(userService.authenticate("nobody", "secret1"));
    }

    @Test
    @DisplayName("用户名过短、密码过短或重复注册被拒绝")
    void testRegister_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> userService.register("ab", "secret1"));
        assertThrows(IllegalArgumentException.class, () -> userService.register("trader1", "12345"));
        userService.register("trader1", "secret1");
        assertThrows(IllegalArgumentException.class, () -> userService.register("trader1", "another1"));
    }

    @Test
    @DisplayName("相同密码每次加盐结果不同，且不保存明文")
    void testHash_Salted() {
        String a = userService.hash("secret1");
        String b = userService.hash("secret1");

        assertNotEquals(a, b);
        assertFalse(a.contains("secret1"));
        assertTrue(userService.verify("secret1", a));
        assertFalse(userService.verify("secret1", "not-base64!"));
    }

    @Test
    @DisplayName("导出再恢复后凭证仍然有效")
    void testExportRestore() {
        userService.register("trader1", "secret1");
        List<StateSnapshot.UserRecord> exported = userService.export();

        UserService restored = new UserService();
        restored.restore(exported);

        assertTrue(restored.authenticate("trader1", "secret1"));
    }

    @Test
    @DisplayName("哈希格式为 base64(16 字节盐 + 32 字节摘要)，与快照中已有的哈希兼容")
    void testHash_FormatCompatible() throws Exception {
        byte[] raw = Base64.getDecoder().decode(userService.hash("secret1"));
        assertEquals(16 + 32, raw.length);

        // 直接用 JDK 的 PBKDF2 生成一个旧格式哈希
        byte[] salt = new byte[16];
        for (int i = 0; i < salt.length; i++) {
            salt[i] = (byte) i;
        }
        PBEKeySpec spec = new PBEKeySpec("secret1".toCharArray(), salt, 120_000, 256);
        byte[] digest = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        byte[] stored = new byte[salt.length + digest.length];
        System.arraycopy(salt, 0, stored, 0, salt.length);
        System.arraycopy(digest, 0, stored, salt.length, digest.length);
        String encoded = Base64.getEncoder().encodeToString(stored);

        assertTrue(userService.verify("secret1", encoded));
        assertFalse(userService.verify("secret2", encoded));
        assertFalse(userService.verify("secret1", Base64.getEncoder().encodeToString(new byte[4])));
    }
}
