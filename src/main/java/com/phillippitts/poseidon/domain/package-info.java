/**
 * Domain models for surf forecast reconciliation.
 *
 * <p>All domain models are immutable records (or enums) that validate themselves in their
 * constructors and carry no framework annotations.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.poseidon.domain.ForecastSample} - a candidate or reconciled dataset
 *       of wave, wind and tide readings, tagged with its {@link com.phillippitts.poseidon.domain.Provenance}</li>
 *   <li>{@link com.phillippitts.poseidon.domain.CandidateResult} - one backend's sample or typed failure</li>
 *   <li>{@link com.phillippitts.poseidon.domain.Coordinates} - where a surf spot is</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.poseidon.domain;
