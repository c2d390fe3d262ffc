package com.example.filegate.common.util;

import com.example.filegate.common.exception.InvalidGroupListException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parses comma-separated frontend group lists such as {@code "3, 7,12"}.
 *
 * <p>Only a null or zero-length list counts as empty. A list made of separators or whitespace
 * is still a restriction and parses to no groups, so nobody matches it. Empty tokens are
 * skipped. Any other token must be an integer (negative pseudo-group ids included); otherwise
 * the whole list is rejected with {@link InvalidGroupListException}.</p>
 */
public final class GroupListParser {

    private static final String SEPARATOR = ",";

    private GroupListParser() {}

    public static boolean isEmpty(@Nullable String groupList) {
        return groupList == null || groupList.isEmpty();
    }

    @NonNull
    public static Set<Integer> parse(@Nullable String groupList) {
        if (isEmpty(groupList)) {
            return Set.of();
        }

        Set<Integer> groupIds = new LinkedHashSet<>();
        for (String token : groupList.split(SEPARATOR)) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                groupIds.add(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new InvalidGroupListException(groupList, trimmed);
            }
        }
        return Collections.unmodifiableSet(groupIds);
    }
}
