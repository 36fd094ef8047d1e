package com.persistentcache.storage.file;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("KeyFileNames 테스트")
class KeyFileNamesTest {

    @DisplayName("인코딩")
    @Nested
    class Encode {

        @DisplayName("구분자와 점은 이스케이프하고 안전한 문자는 그대로 둔다.")
        @Test
        void escapesUnsafeCharacters() {
            // act & assert
            assertThat(KeyFileNames.encode("pc::add::2")).isEqualTo("pc%3A%3Aadd%3A%3A2");
            assertThat(KeyFileNames.encode("a.b/c")).isEqualTo("a%2Eb%2Fc");
        }

        @DisplayName("멀티바이트 문자는 UTF-8 바이트 단위로 이스케이프한다.")
        @Test
        void escapesUtf8Bytes() {
            // act & assert
            assertThat(KeyFileNames.encode("캐시")).isEqualTo("%EC%BA%90%EC%8B%9C");
        }

        @DisplayName("키의 앞부분이 같으면 파일 이름의 앞부분도 같다.")
        @Test
        void preservesPrefix() {
            // act & assert
            assertThat(KeyFileNames.encode("pc::com.example.Calculator#add(int,int)::ab12"))
                .startsWith(KeyFileNames.encode("pc::"));
        }
    }

    @DisplayName("디코딩")
    @Nested
    class Decode {

        @DisplayName("인코딩한 이름을 원래 키로 되돌린다.")
        @Test
        void restoresKey() {
            // arrange
            String key = "pc::com.example.Calculator#add(int,int)::캐시 값";

            // act & assert
            assertThat(KeyFileNames.decode(KeyFileNames.encode(key))).isEqualTo(key);
        }

        @DisplayName("이 클래스가 만들지 않은 이름은 거부한다.")
        @ParameterizedTest
        @ValueSource(strings = {".pending-123.tmp", "notes.txt", "pc%3a%3A", "pc%41", "pc%3", "pc%ZZ"})
        void rejectsForeignNames(String fileName) {
            // act & assert
            assertThatThrownBy(() -> KeyFileNames.decode(fileName))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @DisplayName("저장 파일 이름")
    @Nested
    class FileNameOf {

        private static final String LONG_KEY = "pc::" + "java.util.concurrent.ConcurrentHashMap#computeIfAbsent(".repeat(5) + ")::ab12";

        @DisplayName("짧은 키는 인코딩 결과를 그대로 사용한다.")
        @Test
        void usesEncodedName_whenShort() {
            // act & assert
            assertThat(KeyFileNames.fileNameOf("pc::add::2")).isEqualTo(KeyFileNames.encode("pc::add::2"));
        }

        @DisplayName("긴 키는 네임스페이스를 유지한 다이제스트 이름으로 길이를 제한한다.")
        @Test
        void boundsLength_whenLong() {
            // act
            String fileName = KeyFileNames.fileNameOf(LONG_KEY);

            // assert
            assertThat(KeyFileNames.encode(LONG_KEY).length()).isGreaterThan(KeyFileNames.MAX_FILE_NAME_LENGTH);
            assertThat(fileName)
                .hasSizeLessThanOrEqualTo(KeyFileNames.MAX_FILE_NAME_LENGTH)
                .startsWith(KeyFileNames.encode("pc::"))
                .matches("pc%3A%3A~[0-9a-f]{64}");
            assertThat(KeyFileNames.isFileName(fileName)).isTrue();
        }

        @DisplayName("긴 키끼리도 키가 다르면 파일 이름이 다르다.")
        @Test
        void differsPerKey() {
            // act & assert
            assertThat(KeyFileNames.fileNameOf(LONG_KEY)).isNotEqualTo(KeyFileNames.fileNameOf(LONG_KEY + "3"));
        }

        @DisplayName("이 클래스가 만들 수 없는 이름은 저장 파일로 인정하지 않는다.")
        @ParameterizedTest
        @ValueSource(strings = {"", "notes.txt", "pc%3A%3A~abc", "pc%3A%3A~ABCDEF", "pc%3a~0123"})
        void rejectsForeignNames(String fileName) {
            // act & assert
            assertThat(KeyFileNames.isFileName(fileName)).isFalse();
        }
    }
}
