package dev.videosearch.store;

import dev.videosearch.clip.Modality;

/**
 * Declaration of one vector field of a collection.
 *
 * @param modality modality stored in the field
 * @param name column name
 * @param dimension exact vector length admitted to the field
 * @param metric distance metric used for k-NN queries and the field's index
 */
public record VectorFieldSpec(Modality modality, String name, int dimension, DistanceMetric metric) {}
