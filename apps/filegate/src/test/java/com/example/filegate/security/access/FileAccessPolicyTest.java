package com.example.filegate.security.access;

import com.example.filegate.common.exception.InvalidGroupListException;
import com.example.filegate.security.context.FrontendUser;
import com.example.filegate.storage.ResourceStorage;
import com.example.filegate.storage.model.FileRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Set;

import static com.example.filegate.util.FileRecordTestBuilder.aFileRecord;
import static com.example.filegate.util.FileRecordTestBuilder.aHiddenFile;
import static com.example.filegate.util.FileRecordTestBuilder.aPublicFile;
import static com.example.filegate.util.FileRecordTestBuilder.aRestrictedFile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("FileAccessPolicy")
class FileAccessPolicyTest {

    private static final FrontendUser NO_GROUPS = new FrontendUser("visitor", Set.of());

    @Mock
    private ResourceStorage storage;

    private FileAccessPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new FileAccessPolicy();
        when(storage.isWithinProcessingFolder(anyString())).thenReturn(false);
    }

    private static FrontendUser memberOf(Integer... groupIds) {
        return new FrontendUser("member", Set.of(groupIds));
    }

    @Nested
    @DisplayName("processing folder")
    class ProcessingFolder {

        @Test
        @DisplayName("should allow files in the processing folder even when hidden")
        void shouldAllowProcessedFile() {
            FileRecord file = aFileRecord()
                    .withIdentifier("/_processed_/thumb.png")
                    .withVisible(false)
                    .withFeGroups("3")
                    .build();
            when(storage.isWithinProcessingFolder("/_processed_/thumb.png")).thenReturn(true);

            assertThat(policy.isAccessible(storage, file, NO_GROUPS)).isTrue();
        }

        @Test
        @DisplayName("should not evaluate the group list of processed files")
        void shouldSkipGroupListForProcessedFile() {
            FileRecord file = aFileRecord()
                    .withIdentifier("/_processed_/thumb.png")
                    .withFeGroups("not-a-group")
                    .build();
            when(storage.isWithinProcessingFolder("/_processed_/thumb.png")).thenReturn(true);

            assertThat(policy.isAccessible(storage, file, NO_GROUPS)).isTrue();
        }
    }

    @Nested
    @DisplayName("visibility")
    class Visibility {

        @Test
        @DisplayName("should deny hidden files to every visitor")
        void shouldDenyHiddenFile() {
            assertThat(policy.isAccessible(storage, aHiddenFile(), FrontendUser.anonymous())).isFalse();
            assertThat(policy.isAccessible(storage, aHiddenFile(), memberOf(3, 7))).isFalse();
        }

        @Test
        @DisplayName("should deny hidden files even when the visitor is in an allowed group")
        void shouldDenyHiddenRestrictedFile() {
            FileRecord file = aFileRecord().withVisible(false).withFeGroups("3").build();

            assertThat(policy.isAccessible(storage, file, memberOf(3))).isFalse();
        }

        @Test
        @DisplayName("should treat an absent visibility flag as visible")
        void shouldDefaultToVisible() {
            FileRecord file = aFileRecord().withVisible(null).build();

            assertThat(policy.isAccessible(storage, file, NO_GROUPS)).isTrue();
        }
    }

    @Nested
    @DisplayName("access groups")
    class AccessGroups {

        @Test
        @DisplayName("should allow public files to anyone")
        void shouldAllowPublicFile() {
            assertThat(policy.isAccessible(storage, aPublicFile(), FrontendUser.anonymous())).isTrue();
            assertThat(policy.isAccessible(storage, aPublicFile(), NO_GROUPS)).isTrue();
            assertThat(policy.isAccessible(storage, aRestrictedFile(""), NO_GROUPS)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {",", " , ", "  ", ",,"})
        @DisplayName("should deny everyone when the group list holds no ids")
        void shouldDenySeparatorOnlyGroupList(String feGroups) {
            FileRecord file = aRestrictedFile(feGroups);

            assertThat(policy.isAccessible(storage, file, memberOf(9))).isFalse();
            assertThat(policy.isAccessible(storage, file, FrontendUser.anonymous())).isFalse();
            assertThat(policy.isAccessible(storage, file, FrontendUser.authenticated("jane", Set.of(3)))).isFalse();
        }

        @Test
        @DisplayName("should allow when the visitor shares at least one group")
        void shouldAllowOnIntersection() {
            FileRecord file = aRestrictedFile("3,7");

            assertThat(policy.isAccessible(storage, file, memberOf(7))).isTrue();
            assertThat(policy.isAccessible(storage, file, memberOf(3, 7))).isTrue();
            assertThat(policy.isAccessible(storage, file, memberOf(1, 3))).isTrue();
        }

        @Test
        @DisplayName("should deny when the visitor shares no group")
        void shouldDenyWithoutIntersection() {
            FileRecord file = aRestrictedFile("3,7");

            assertThat(policy.isAccessible(storage, file, memberOf(9))).isFalse();
            assertThat(policy.isAccessible(storage, file, NO_GROUPS)).isFalse();
            assertThat(policy.isAccessible(storage, file, FrontendUser.anonymous())).isFalse();
        }

        @Test
        @DisplayName("should grant any-login files to authenticated visitors only")
        void shouldHonourAnyLoginPseudoGroup() {
            FileRecord file = aRestrictedFile(String.valueOf(FrontendUser.ANY_LOGIN_GROUP));

            assertThat(policy.isAccessible(storage, file, FrontendUser.authenticated("jane", Set.of()))).isTrue();
            assertThat(policy.isAccessible(storage, file, FrontendUser.anonymous())).isFalse();
        }

        @Test
        @DisplayName("should reject a malformed group list")
        void shouldRejectMalformedGroupList() {
            FileRecord file = aRestrictedFile("3,seven");

            assertThatThrownBy(() -> policy.isAccessible(storage, file, memberOf(3)))
                    .isInstanceOf(InvalidGroupListException.class)
                    .hasMessageContaining("seven");
        }
    }
}
