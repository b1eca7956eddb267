package com.verve.types.common;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * 业务 ID 生成与校验。
 * <p>
 * 任务 ID 形如 {@code tsk-a1b2c}；epic 与 repo ID 形如 {@code epc_<26 位 base32>}，
 * 前 10 位编码毫秒时间戳，其余为随机位，按字典序大致有序。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
public final class IdGenerator {

    public static final String TASK_PREFIX = "tsk-";
    public static final String EPIC_PREFIX = "epc_";
    public static final String REPO_PREFIX = "repo_";

    private static final String TASK_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final char[] CROCKFORD = "0123456789abcdefghjkmnpqrstvwxyz".toCharArray();
    private static final int TASK_SUFFIX_LENGTH = 5;
    private static final int TYPEID_SUFFIX_LENGTH = 26;

    private static final Pattern TASK_ID_PATTERN = Pattern.compile("^tsk-[a-z0-9]{5}$");
    private static final Pattern EPIC_ID_PATTERN = Pattern.compile("^epc_[0-9a-hjkmnp-tv-z]{26}$");
    private static final Pattern REPO_ID_PATTERN = Pattern.compile("^repo_[0-9a-hjkmnp-tv-z]{26}$");

    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {
    }

    public static String newTaskId() {
        StringBuilder sb = new StringBuilder(TASK_PREFIX);
        for (int i = 0; i < TASK_SUFFIX_LENGTH; i++) {
            sb.append(TASK_ALPHABET.charAt(RANDOM.nextInt(TASK_ALPHABET.length())));
        }
        return sb.toString();
    }

    public static String newEpicId() {
        return EPIC_PREFIX + typeIdSuffix(System.currentTimeMillis());
    }

    public static String newRepoId() {
        return REPO_PREFIX + typeIdSuffix(System.currentTimeMillis());
    }

    public static boolean isTaskId(String id) {
        return id != null && TASK_ID_PATTERN.matcher(id).matches();
    }

    public static boolean isEpicId(String id) {
        return id != null && EPIC_ID_PATTERN.matcher(id).matches();
    }

    public static boolean isRepoId(String id) {
        return id != null && REPO_ID_PATTERN.matcher(id).matches();
    }

    static String typeIdSuffix(long epochMillis) {
        char[] out = new char[TYPEID_SUFFIX_LENGTH];
        // 48 位时间戳占前 10 个字符（50 位，高 2 位为 0）
        long ts = epochMillis & 0xFFFFFFFFFFFFL;
        for (int i = 9; i >= 0; i--) {
            out[i] = CROCKFORD[(int) (ts & 0x1F)];
            ts >>>= 5;
        }
        for (int i = 10; i < TYPEID_SUFFIX_LENGTH; i++) {
            out[i] = CROCKFORD[RANDOM.nextInt(CROCKFORD.length)];
        }
        return new String(out);
    }
}
