/**
 * Image codec seam used by jobs to split sources into channels and write results.
 */
package com.phillippitts.simrecon.service.dataset;
