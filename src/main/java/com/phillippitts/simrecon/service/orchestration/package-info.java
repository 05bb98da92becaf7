/**
 * Job lifecycle and batch scheduling.
 *
 * <p>{@link com.phillippitts.simrecon.service.orchestration.ReconstructionService} and
 * {@link com.phillippitts.simrecon.service.orchestration.OtfConversionService} build one job
 * per input file and hand the batch to
 * {@link com.phillippitts.simrecon.service.orchestration.JobOrchestrator}, which runs it in
 * one of the {@link com.phillippitts.simrecon.service.orchestration.SchedulingMode}s.
 */
package com.phillippitts.simrecon.service.orchestration;
