/*
 * Copyright 2026 The Kythe Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.autofix.template;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.autofix.TemplateParseException;
import com.google.devtools.autofix.source.OffsetUnit;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Parses and caches the fix templates of rules. Safe for concurrent use by scanning workers.
 *
 * <p>Each (rule, language, text) is parsed at most once. A parse failure is logged once and
 * remembered, so every later match of that rule reports the same failure without a fix while other
 * rules are unaffected.
 */
public final class FixTemplates {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableMap<String, LanguageParser> parsers;
  private final OffsetUnit unit;
  private final ConcurrentMap<Key, Entry> cache = new ConcurrentHashMap<>();

  public FixTemplates(Iterable<? extends LanguageParser> parsers, OffsetUnit unit) {
    ImmutableMap.Builder<String, LanguageParser> byLanguage = ImmutableMap.builder();
    for (LanguageParser parser : parsers) {
      byLanguage.put(parser.language(), parser);
    }
    this.parsers = byLanguage.buildOrThrow();
    this.unit = checkNotNull(unit, "unit");
  }

  public OffsetUnit getOffsetUnit() {
    return unit;
  }

  /**
   * Returns the parsed template of {@code ruleId} in {@code language}.
   *
   * @throws TemplateParseException if the template does not parse, now or on an earlier call
   */
  public FixTemplate get(String ruleId, String language, String fixText)
      throws TemplateParseException {
    Entry entry = cache.computeIfAbsent(Key.create(ruleId, language, fixText), this::parse);
    if (entry.error().isPresent()) {
      throw entry.error().get();
    }
    return entry.template().get();
  }

  /** Returns true if the template of {@code ruleId} has been parsed and failed. */
  public boolean isDisabled(String ruleId, String language, String fixText) {
    Entry entry = cache.get(Key.create(ruleId, language, fixText));
    return entry != null && entry.error().isPresent();
  }

  private Entry parse(Key key) {
    LanguageParser parser = parsers.get(key.language());
    try {
      if (parser == null) {
        throw new TemplateParseException(key.language(), "no parser registered for the language");
      }
      FixTemplate template = FixTemplate.parse(key.ruleId(), parser, key.text(), unit);
      logger.atFine().log(
          "parsed fix template of %s: placeholders %s", key.ruleId(), template.placeholderNames());
      return Entry.of(template);
    } catch (TemplateParseException e) {
      logger.atWarning().withCause(e).log("autofix disabled for rule %s", key.ruleId());
      return Entry.failed(e);
    }
  }

  @AutoValue
  abstract static class Key {
    abstract String ruleId();

    abstract String language();

    abstract String text();

    static Key create(String ruleId, String language, String text) {
      return new AutoValue_FixTemplates_Key(ruleId, language, text);
    }
  }

  @AutoValue
  abstract static class Entry {
    abstract Optional<FixTemplate> template();

    abstract Optional<TemplateParseException> error();

    static Entry of(FixTemplate template) {
      return new AutoValue_FixTemplates_Entry(Optional.of(template), Optional.empty());
    }

    static Entry failed(TemplateParseException error) {
      return new AutoValue_FixTemplates_Entry(Optional.empty(), Optional.of(error));
    }
  }
}
