/*
 * Copyright (c) 2004-2025 The mzmine Development Team
 */

package io.github.linefit.parameters;

import com.google.common.collect.Range;
import io.github.linefit.modules.dataprocessing.gaussdecomp.HierarchicalFitterParameters;
import io.github.linefit.modules.dataprocessing.gaussdecomp.SolverMethod;
import io.github.linefit.parameters.impl.SimpleParameterSet;
import io.github.linefit.parameters.parametertypes.IntegerParameter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SimpleParameterSetTest {

  @Test
  void testDefaultsAreValid() {
    final HierarchicalFitterParameters params = new HierarchicalFitterParameters();
    final List<String> errors = new ArrayList<>();
    Assertions.assertTrue(params.checkParameterValues(errors), errors::toString);
    Assertions.assertEquals(10, params.getValue(HierarchicalFitterParameters.maxComponents));
    Assertions.assertEquals(Range.closed(1d, 30d),
        params.getValue(HierarchicalFitterParameters.sigmaRange));
    Assertions.assertEquals(7d, params.getValue(HierarchicalFitterParameters.velocityHalfWidth));
    Assertions.assertEquals(10d, params.getValue(HierarchicalFitterParameters.seedSigma));
    Assertions.assertEquals(SolverMethod.LEASTSQ,
        params.getValue(HierarchicalFitterParameters.solverMethod));
  }

  @Test
  void testStaticDeclarationsAreNotModified() {
    final HierarchicalFitterParameters params = new HierarchicalFitterParameters();
    params.setParameter(HierarchicalFitterParameters.maxComponents, 3);
    Assertions.assertEquals(3, params.getValue(HierarchicalFitterParameters.maxComponents));
    Assertions.assertEquals(10, HierarchicalFitterParameters.maxComponents.getValue());
  }

  @Test
  void testCloneIsIndependent() {
    final HierarchicalFitterParameters params = new HierarchicalFitterParameters();
    params.setParameter(HierarchicalFitterParameters.seedSigma, 4d);
    final ParameterSet clone = params.cloneParameterSet();
    Assertions.assertTrue(clone instanceof HierarchicalFitterParameters);
    Assertions.assertEquals(4d, clone.getValue(HierarchicalFitterParameters.seedSigma));

    clone.setParameter(HierarchicalFitterParameters.seedSigma, 8d);
    Assertions.assertEquals(4d, params.getValue(HierarchicalFitterParameters.seedSigma));
  }

  @Test
  void testInvalidValuesAreReported() {
    final HierarchicalFitterParameters params = new HierarchicalFitterParameters();
    params.setParameter(HierarchicalFitterParameters.maxComponents, 0);
    params.setParameter(HierarchicalFitterParameters.sigmaRange, Range.atLeast(1d));
    params.setParameter(HierarchicalFitterParameters.solverMethod, null);
    final List<String> errors = new ArrayList<>();
    Assertions.assertFalse(params.checkParameterValues(errors));
    Assertions.assertEquals(3, errors.size(), errors::toString);
  }

  @Test
  void testUnknownParameterIsRejected() {
    final SimpleParameterSet params = new HierarchicalFitterParameters();
    final IntegerParameter foreign = new IntegerParameter("Foreign", "Not declared", 1);
    Assertions.assertThrows(IllegalArgumentException.class, () -> params.getParameter(foreign));
  }

  @Test
  void testSolverMethodIdentifiers() {
    Assertions.assertEquals(SolverMethod.LEASTSQ, SolverMethod.fromIdentifier("leastsq"));
    Assertions.assertEquals(SolverMethod.GAUSS_NEWTON,
        SolverMethod.fromIdentifier(" Gauss_Newton "));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SolverMethod.fromIdentifier("nelder"));
  }
}
