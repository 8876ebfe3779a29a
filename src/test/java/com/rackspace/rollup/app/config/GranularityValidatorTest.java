package com.rackspace.rollup.app.config;

import static org.assertj.core.api.AssertionsForClassTypes.assertThat;

import com.rackspace.rollup.app.config.RollupModelProperties.PreAggregation;
import com.rackspace.rollup.app.config.configValidator.ConcreteGranularityValidator;
import com.rackspace.rollup.app.model.Granularity;
import java.util.LinkedList;
import java.util.List;
import org.junit.jupiter.api.Test;


public class GranularityValidatorTest {

  @Test
  public void invalidGranularities() {
    PreAggregation preAggregation = new PreAggregation();
    preAggregation.setGranularity(Granularity.HOUR);
    preAggregation.setPartitionGranularity(Granularity.DAY);
    List<PreAggregation> preAggregations = new LinkedList<>();
    preAggregations.add(preAggregation);
    preAggregation = new PreAggregation();
    preAggregation.setGranularity(Granularity.WEEK);
    preAggregation.setPartitionGranularity(Granularity.MONTH);
    preAggregations.add(preAggregation);

    ConcreteGranularityValidator validator = new ConcreteGranularityValidator();
    assertThat(validator.isValid(preAggregations, null)).isFalse();
  }

  @Test
  public void validGranularities() {
    PreAggregation preAggregation = new PreAggregation();
    preAggregation.setGranularity(Granularity.HOUR);
    preAggregation.setPartitionGranularity(Granularity.DAY);
    List<PreAggregation> preAggregations = new LinkedList<>();
    preAggregations.add(preAggregation);
    preAggregation = new PreAggregation();
    preAggregation.setGranularity(Granularity.MONTH);
    preAggregation.setPartitionGranularity(Granularity.YEAR);
    preAggregations.add(preAggregation);

    ConcreteGranularityValidator validator = new ConcreteGranularityValidator();
    assertThat(validator.isValid(preAggregations, null)).isTrue();
  }

  @Test
  public void partitionGranularityDefaultsToRowGranularity() {
    PreAggregation preAggregation = new PreAggregation();
    preAggregation.setGranularity(Granularity.WEEK);
    List<PreAggregation> preAggregations = new LinkedList<>();
    preAggregations.add(preAggregation);

    ConcreteGranularityValidator validator = new ConcreteGranularityValidator();
    assertThat(validator.isValid(preAggregations, null)).isTrue();
  }

  @Test
  public void emptyListGranularity() {
    List<PreAggregation> preAggregations = new LinkedList<>();

    ConcreteGranularityValidator validator = new ConcreteGranularityValidator();
    assertThat(validator.isValid(preAggregations, null)).isTrue();
  }

  @Test
  public void nullGranularities() {
    ConcreteGranularityValidator validator = new ConcreteGranularityValidator();
    assertThat(validator.isValid(null, null)).isTrue();
  }
}
