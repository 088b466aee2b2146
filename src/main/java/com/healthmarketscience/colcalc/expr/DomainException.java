/*
Copyright (c) 2026 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.colcalc.expr;

/**
 * Exception thrown when a value falls outside the domain of an operation
 * (division by zero, log of a non-positive number, an IRR which does not
 * converge).
 *
 * @author James Ahlborn
 */
public class DomainException extends EvalException
{
  private static final long serialVersionUID = 20260304L;

  public DomainException(String message) {
    super(message);
  }

  public DomainException(String message, Throwable cause) {
    super(message, cause);
  }
}
