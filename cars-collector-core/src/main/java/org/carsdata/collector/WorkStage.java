package org.carsdata.collector;

/**
 * Network-bound pipeline stage a unit of work belongs to.
 */
public enum WorkStage {

	PAGE, DETAIL

}
