/*
 * Copyright 2013 Matt T. Proud (matt.proud@gmail.com) Copyright 2012 Andrew
 * Wang (andrew@umbrant.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package com.matttproud.gkarray;

/**
 * <p>
 * Raised when two {@link GKArray} summaries built with different error bounds
 * are merged.
 * </p>
 */
public class IncompatiblePrecisionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final double epsilon;
  private final double otherEpsilon;

  public IncompatiblePrecisionException(final double epsilon, final double otherEpsilon) {
    super(String.format("Cannot merge summaries with different epsilon values (%s vs %s)",
        epsilon, otherEpsilon));
    this.epsilon = epsilon;
    this.otherEpsilon = otherEpsilon;
  }

  public double getEpsilon() {
    return epsilon;
  }

  public double getOtherEpsilon() {
    return otherEpsilon;
  }
}
