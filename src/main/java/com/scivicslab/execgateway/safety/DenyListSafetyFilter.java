/*
 * Copyright 2025 devteam@scivics-lab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.execgateway.safety;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Text based {@link SafetyFilter} that refuses any reference to a connection
 * secret variable.
 *
 * <p>This blocks a command or playbook from reading another host's stored
 * credentials through templating, e.g. {@code echo {{ ansible_ssh_pass }}}.
 * It is a pattern match on raw text, not a parse of the playbook, so it can
 * be defeated by constructing the name at runtime. It is a guard, not a
 * proof of safety.</p>
 *
 * <p>Matching rules:</p>
 * <ol>
 *   <li>The playbook keywords {@code vars:} and {@code vars_files:} are
 *       neutralized first, also as the tail of a longer key such as
 *       {@code include_vars:}. A key ending in a letter or digit before
 *       {@code vars:}, like {@code hostvars:}, is left alone.</li>
 *   <li>Secret names ({@link #SECRET_NAMES}) are found anywhere in the text,
 *       ignoring case, so {@code /tmp/ansible_ssh_pass.txt} is refused too.</li>
 *   <li>The generic names {@code vars} and {@code hostvars}
 *       ({@link #IDENTIFIER_NAMES}) only count as whole identifiers: the
 *       characters on either side must not be letters, digits or
 *       {@code _}. {@code group_vars}, {@code vars_prompt} and
 *       {@code myvars} pass.</li>
 *   <li>Longer names are tried first, so {@code ansible_become_password}
 *       is reported as itself and not as {@code ansible_become_pass}. The
 *       first occurrence is reported in its deny-list spelling.</li>
 * </ol>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class DenyListSafetyFilter implements SafetyFilter {

    /** Generic variable tables, refused as whole identifiers only. */
    public static final List<String> IDENTIFIER_NAMES = List.of(
        "vars",
        "hostvars"
    );

    /** Variables holding connection secrets, refused wherever they appear. */
    public static final List<String> SECRET_NAMES = List.of(
        "ansible_ssh_pass",
        "ansible_password",
        "ansible_ssh_private_key_file",
        "ansible_private_key_file",
        "ansible_become_pass",
        "ansible_become_password",
        "ansible_enable_pass",
        "ansible_pass",
        "ansible_sudo_pass",
        "ansible_sudo_password",
        "ansible_su_pass",
        "ansible_su_password",
        "vault_password"
    );

    /** Every refused name. */
    public static final List<String> DENY_LIST = Stream.concat(IDENTIFIER_NAMES.stream(), SECRET_NAMES.stream())
        .collect(Collectors.toUnmodifiableList());

    private static final Pattern KEYWORDS = Pattern.compile("(?<![A-Za-z0-9])(vars_files|vars):");

    private static final String KEYWORD_PLACEHOLDER = "+++";

    private static final String WORD_CHAR = "[A-Za-z0-9_]";

    private final List<String> denyList;
    private final Pattern pattern;

    /**
     * Constructs a filter using {@link #IDENTIFIER_NAMES} and {@link #SECRET_NAMES}.
     */
    public DenyListSafetyFilter() {
        this(IDENTIFIER_NAMES, SECRET_NAMES);
    }

    /**
     * Constructs a filter refusing custom secret names wherever they appear.
     *
     * @param secretNames the protected variable names
     */
    public DenyListSafetyFilter(List<String> secretNames) {
        this(List.of(), secretNames);
    }

    /**
     * Constructs a filter with custom names.
     *
     * @param identifierNames names refused as whole identifiers only
     * @param secretNames names refused anywhere in the text
     */
    public DenyListSafetyFilter(List<String> identifierNames, List<String> secretNames) {
        List<String> identifiers = lowerCase(identifierNames);
        List<String> secrets = lowerCase(secretNames);
        this.denyList = Stream.concat(identifiers.stream(), secrets.stream())
            .collect(Collectors.toUnmodifiableList());

        // longest first so ansible_become_password is not cut at ansible_become_pass
        String alternation = this.denyList.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(name -> identifiers.contains(name) && !secrets.contains(name)
                ? "(?<!" + WORD_CHAR + ")" + Pattern.quote(name) + "(?!" + WORD_CHAR + ")"
                : Pattern.quote(name))
            .collect(Collectors.joining("|"));
        this.pattern = Pattern.compile(alternation, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public Optional<String> scan(String text) {
        if (text == null || text.isEmpty() || denyList.isEmpty()) {
            return Optional.empty();
        }
        String content = KEYWORDS.matcher(text).replaceAll(KEYWORD_PLACEHOLDER);

        Matcher matcher = pattern.matcher(content);
        if (matcher.find()) {
            return Optional.of(matcher.group().toLowerCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    public List<String> getDenyList() {
        return denyList;
    }

    private static List<String> lowerCase(List<String> names) {
        return names.stream()
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
    }
}
