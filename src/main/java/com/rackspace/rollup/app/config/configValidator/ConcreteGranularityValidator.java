/*
 * Copyright 2020 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.rollup.app.config.configValidator;

import com.rackspace.rollup.app.config.RollupModelProperties.PreAggregation;
import java.util.List;
import javax.validation.ConstraintValidator;
import javax.validation.ConstraintValidatorContext;

public class ConcreteGranularityValidator implements ConstraintValidator<GranularityValidator, List<PreAggregation>> {

  @Override
  public boolean isValid(List<PreAggregation> preAggregations, ConstraintValidatorContext constraintValidatorContext) {
    if (preAggregations == null) {
      return true;
    }

    for (PreAggregation preAggregation : preAggregations) {
      if (preAggregation.getGranularity() == null) {
        continue;
      }
      if (!preAggregation.getEffectivePartitionGranularity()
          .isMultipleOf(preAggregation.getGranularity())) {
        return false;
      }
    }
    return true;
  }
}
