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

package com.google.devtools.autofix;

/**
 * A fix could not be produced. Each subclass is local to one rule or one match: the finding is
 * still reported, without a fix, and scanning continues.
 */
public abstract class AutofixException extends Exception {
  private static final long serialVersionUID = 1L;

  protected AutofixException(String message) {
    super(message);
  }

  protected AutofixException(String message, Throwable cause) {
    super(message, cause);
  }
}
