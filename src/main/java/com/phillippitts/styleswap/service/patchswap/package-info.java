/**
 * Feature-space patch swap: the core of the style transfer.
 *
 * <p>Given content and style feature maps of equal depth:
 * <ol>
 *   <li>{@link com.phillippitts.styleswap.service.patchswap.PatchExtractor} enumerates every
 *       {@code C×3×3} patch of the style map in row-major order and L2-normalizes a copy of
 *       each</li>
 *   <li>{@link com.phillippitts.styleswap.service.patchswap.CorrelationMatcher} slides every
 *       normalized patch over the content map (stride 1, no padding) and keeps, per position,
 *       the index of the highest response; ties go to the lowest index</li>
 *   <li>{@link com.phillippitts.styleswap.service.patchswap.PatchAssembler} pastes the raw
 *       winning patches back at their content positions and averages overlaps</li>
 * </ol>
 *
 * <p>The enumeration order of patches is shared by extraction and reconstruction; the index in
 * an {@link com.phillippitts.styleswap.domain.Assignment} is only meaningful under that order.
 *
 * <p>Nothing in this package logs, keeps state between calls or allocates a one-hot volume.
 */
package com.phillippitts.styleswap.service.patchswap;
