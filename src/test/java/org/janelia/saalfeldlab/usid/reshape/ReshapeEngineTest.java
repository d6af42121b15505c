package org.janelia.saalfeldlab.usid.reshape;

import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import org.janelia.saalfeldlab.usid.UsidFixtures;
import org.janelia.saalfeldlab.usid.dimension.DimensionOrder;
import org.janelia.saalfeldlab.usid.dimension.DimensionRegistry;
import org.janelia.saalfeldlab.usid.selection.PosSpecIndices;
import org.janelia.saalfeldlab.usid.selection.Selector;
import org.janelia.saalfeldlab.usid.selection.SelectorResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.janelia.saalfeldlab.usid.UsidFixtures.flatValues;
import static org.janelia.saalfeldlab.usid.UsidFixtures.mainValue;
import static org.janelia.saalfeldlab.usid.UsidFixtures.valueAt;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ReshapeEngineTest {

	private final DimensionRegistry registry = UsidFixtures.referenceRegistry();

	private final ReshapeEngine engine = new ReshapeEngine(registry);

	private final DensityClassifier classifier = new DensityClassifier(registry);

	private final SelectorResolver resolver = new SelectorResolver(registry);

	private ArrayImg<DoubleType, DoubleArray> main;

	@BeforeEach
	public void setUp() {

		main = ArrayImgs.doubles(15, 14);
		final Cursor<DoubleType> cursor = main.localizingCursor();
		while (cursor.hasNext()) {
			cursor.fwd();
			cursor.get().set(mainValue(cursor.getLongPosition(0), cursor.getLongPosition(1)));
		}
	}

	@Test
	public void testFlat() {

		final PosSpecIndices indices = new PosSpecIndices(new long[]{2, 7}, new long[]{0, 13});
		final IndexMappedRandomAccessibleInterval<DoubleType> flat = engine.flat(main, indices);
		assertEquals(List.of(ReshapeEngine.FLAT_POSITION_LABEL, ReshapeEngine.FLAT_SPECTROSCOPIC_LABEL), flat.getAxisLabels());
		assertArrayEquals(
				new double[]{mainValue(2, 0), mainValue(7, 0), mainValue(2, 13), mainValue(7, 13)},
				flatValues(flat));
	}

	@Test
	public void testNDimFlattensToFlat() {

		final PosSpecIndices indices = resolver.resolve(Map.of("X", Selector.list(0, 4), "Bias", Selector.range(2L, 5L)));
		final Density density = classifier.classify(indices);
		final IndexMappedRandomAccessibleInterval<DoubleType> nDim = engine.nDim(main, indices, density, DimensionOrder.FILE, false);
		assertArrayEquals(new long[]{2, 3, 3, 2}, Intervals.dimensionsAsLongArray(nDim));
		assertArrayEquals(flatValues(engine.flat(main, indices)), flatValues(nDim));
	}

	@Test
	public void testSortedAxesArePermuted() {

		final PosSpecIndices indices = resolver.resolve(null);
		final Density density = classifier.classify(indices);
		final IndexMappedRandomAccessibleInterval<DoubleType> file = engine.nDim(main, indices, density, DimensionOrder.FILE, false);
		final IndexMappedRandomAccessibleInterval<DoubleType> sorted = engine.nDim(main, indices, density, DimensionOrder.SORTED, false);
		assertEquals(List.of("Y", "X", "Cycle", "Bias"), sorted.getAxisLabels());
		assertArrayEquals(
				flatValues(Views.permute(Views.permute(file, 0, 1), 2, 3)),
				flatValues(sorted));
		assertArrayEquals(engine.nDimShape(DimensionOrder.SORTED), Intervals.dimensionsAsLongArray(sorted));
	}

	@Test
	public void testSqueeze() {

		final PosSpecIndices indices = resolver.resolve(Map.of("Y", 2, "Cycle", 0));
		final Density density = classifier.classify(indices);
		final IndexMappedRandomAccessibleInterval<DoubleType> squeezed = engine.nDim(main, indices, density, DimensionOrder.FILE, true);
		assertEquals(List.of("X", "Bias"), squeezed.getAxisLabels());
		assertEquals(mainValue(3 + 10, 4), valueAt(squeezed, 3, 4));

		final IndexMappedRandomAccessibleInterval<DoubleType> full = engine.nDim(main, indices, density, DimensionOrder.FILE, false);
		assertArrayEquals(new long[]{5, 1, 7, 1}, Intervals.dimensionsAsLongArray(full));
	}

	@Test
	public void testSparseSelectionIsNotReshaped() {

		final PosSpecIndices indices = new PosSpecIndices(new long[]{0, 6}, new long[]{0});
		assertThrows(IllegalArgumentException.class, () -> engine.nDim(main, indices, classifier.classify(indices), DimensionOrder.FILE, true));
	}

	@Test
	public void testRandomAccessCopies() {

		final IndexMappedRandomAccessibleInterval<DoubleType> flat = engine.flat(main, resolver.resolve(null));
		final IndexMappedRandomAccessibleInterval<DoubleType>.MappedRandomAccess access = flat.randomAccess();
		access.setPosition(new long[]{4, 5});
		final IndexMappedRandomAccessibleInterval<DoubleType>.MappedRandomAccess copy = access.copy();
		access.fwd(0);
		assertEquals(mainValue(4, 5), copy.get().getRealDouble());
		assertEquals(mainValue(5, 5), access.get().getRealDouble());
	}
}
