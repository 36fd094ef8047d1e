package com.persistentcache.storage.file;

import com.persistentcache.storage.CacheStorage;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 캐시 키와 파일 이름 사이의 변환 유틸리티.
 * <p>
 * 키의 UTF-8 바이트 중 {@code [A-Za-z0-9_-(),=+@]}는 그대로 두고, 나머지 바이트는 {@code %XX}로 기록합니다.
 * 예: {@code pc::add::2} → {@code pc%3A%3Aadd%3A%3A2}
 * </p>
 * <p>
 * <b>성질:</b>
 * <ul>
 *   <li>역변환이 가능합니다.</li>
 *   <li>문자열 앞부분이 같으면 변환 결과의 앞부분도 같으므로, 프리픽스 매칭을 파일 이름에 그대로 적용할 수 있습니다.</li>
 *   <li>{@code .}도 변환되므로 변환 결과는 절대 {@code .}으로 시작하지 않습니다. 숨김 작업 파일과 겹치지 않습니다.</li>
 * </ul>
 * </p>
 * <p>
 * <b>긴 키:</b>
 * 파일 시스템의 이름 길이 제한(보통 255바이트)을 넘지 않도록, 변환 결과가 {@value #MAX_FILE_NAME_LENGTH}자를
 * 넘으면 {@link #fileNameOf(String)}는 네임스페이스({@code prefix::})만 변환하여 남기고 나머지는
 * {@code ~} 뒤에 키 전체의 SHA-256 값으로 대체합니다.
 * 예: {@code pc%3A%3A~3f1a...}. {@code ~}는 변환 결과에 나타나지 않으므로 두 형식은 겹치지 않습니다.
 * </p>
 *
 * @author PersistentCache
 * @version 1.0
 */
public final class KeyFileNames {

    /**
     * 파일 이름의 최대 길이. 잠금 파일 확장자({@code .lock})를 붙여도 255바이트를 넘지 않습니다.
     */
    public static final int MAX_FILE_NAME_LENGTH = 200;

    private static final char ESCAPE = '%';
    private static final char DIGEST_MARKER = '~';
    private static final int DIGEST_LENGTH = 64;
    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private KeyFileNames() {
    }

    /**
     * 키를 저장할 파일 이름을 반환합니다.
     * <p>
     * 변환 결과가 {@value #MAX_FILE_NAME_LENGTH}자 이하이면 {@link #encode(String)}와 같고,
     * 그보다 길면 네임스페이스를 유지한 다이제스트 이름을 반환합니다.
     * </p>
     *
     * @param key 캐시 키
     * @return 파일 이름 (최대 {@value #MAX_FILE_NAME_LENGTH}자)
     * @throws IllegalArgumentException 네임스페이스만으로도 길이 제한을 넘는 경우
     */
    public static String fileNameOf(String key) {
        String encoded = encode(key);
        if (encoded.length() <= MAX_FILE_NAME_LENGTH) {
            return encoded;
        }
        int separator = key.indexOf(CacheStorage.KEY_SEPARATOR);
        String namespace = separator >= 0 ? key.substring(0, separator + CacheStorage.KEY_SEPARATOR.length()) : "";
        String fileName = encode(namespace) + DIGEST_MARKER + digest(key);
        if (fileName.length() > MAX_FILE_NAME_LENGTH) {
            throw new IllegalArgumentException("캐시 프리픽스가 너무 깁니다. (key: " + key + ")");
        }
        return fileName;
    }

    /**
     * 이 클래스가 만든 파일 이름인지 확인합니다.
     *
     * @param fileName 파일 이름
     * @return {@link #fileNameOf(String)}가 만들 수 있는 이름이면 true
     */
    public static boolean isFileName(String fileName) {
        if (fileName.isEmpty() || fileName.length() > MAX_FILE_NAME_LENGTH) {
            return false;
        }
        int marker = fileName.indexOf(DIGEST_MARKER);
        try {
            if (marker < 0) {
                decode(fileName);
                return true;
            }
            decode(fileName.substring(0, marker));
        } catch (IllegalArgumentException e) {
            return false;
        }
        String digest = fileName.substring(marker + 1);
        return digest.length() == DIGEST_LENGTH && digest.chars().allMatch(KeyFileNames::isLowerHex);
    }

    /**
     * 키를 파일 이름 형식으로 변환합니다. 길이 제한은 적용하지 않습니다.
     *
     * @param key 캐시 키
     * @return 파일 이름
     */
    public static String encode(String key) {
        byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
        StringBuilder fileName = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int value = b & 0xFF;
            if (isSafe(value)) {
                fileName.append((char) value);
            } else {
                fileName.append(ESCAPE)
                    .append(HEX_DIGITS[value >> 4])
                    .append(HEX_DIGITS[value & 0x0F]);
            }
        }
        return fileName.toString();
    }

    /**
     * 파일 이름을 키로 되돌립니다.
     *
     * @param fileName 파일 이름
     * @return 캐시 키
     * @throws IllegalArgumentException 이 클래스가 만든 이름이 아닌 경우
     */
    public static String decode(String fileName) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(fileName.length());
        int index = 0;
        while (index < fileName.length()) {
            char c = fileName.charAt(index);
            if (c == ESCAPE) {
                if (index + 2 >= fileName.length()) {
                    throw new IllegalArgumentException("잘못된 이스케이프 시퀀스입니다. (fileName: " + fileName + ")");
                }
                int value = hexValue(fileName, index + 1) << 4 | hexValue(fileName, index + 2);
                if (isSafe(value)) {
                    throw new IllegalArgumentException("불필요한 이스케이프 시퀀스입니다. (fileName: " + fileName + ")");
                }
                bytes.write(value);
                index += 3;
            } else if (isSafe(c)) {
                bytes.write(c);
                index++;
            } else {
                throw new IllegalArgumentException("파일 이름에 허용되지 않는 문자가 있습니다. (fileName: " + fileName + ")");
            }
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static String digest(String key) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().formatHex(messageDigest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " 알고리즘을 사용할 수 없습니다.", e);
        }
    }

    private static boolean isLowerHex(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
    }

    private static int hexValue(String fileName, int index) {
        int value = Character.digit(fileName.charAt(index), 16);
        if (value < 0 || Character.isLowerCase(fileName.charAt(index))) {
            throw new IllegalArgumentException("잘못된 16진수 문자입니다. (fileName: " + fileName + ")");
        }
        return value;
    }

    private static boolean isSafe(int value) {
        return (value >= 'A' && value <= 'Z')
            || (value >= 'a' && value <= 'z')
            || (value >= '0' && value <= '9')
            || value == '_' || value == '-'
            || value == '(' || value == ')'
            || value == ',' || value == '='
            || value == '+' || value == '@';
    }
}
