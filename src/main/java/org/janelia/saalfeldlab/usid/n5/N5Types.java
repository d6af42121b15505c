package org.janelia.saalfeldlab.usid.n5;

import org.janelia.saalfeldlab.n5.DataType;

public class N5Types {

	private N5Types() {

	}

	/**
	 * Check if {@code type} is integer tpye
	 *
	 * @param type {@link DataType}
	 * @return {@code true} if {@code type} is integer type, false otherwise
	 */
	public static boolean isIntegerType(final DataType type) {

		switch (type) {
		case INT8:
		case INT16:
		case INT32:
		case INT64:
		case UINT8:
		case UINT16:
		case UINT32:
		case UINT64:
			return true;
		default:
			return false;
		}
	}

	/**
	 * @param type {@link DataType}
	 * @return {@code true} if {@code type} holds real numbers that can be read as {@code double}
	 */
	public static boolean isRealType(final DataType type) {

		return isIntegerType(type) || type == DataType.FLOAT32 || type == DataType.FLOAT64;
	}

	/**
	 * Convert the primitive array of a {@link org.janelia.saalfeldlab.n5.DataBlock} to {@code double}, interpreting
	 * unsigned types as unsigned.
	 *
	 * @param data primitive array matching {@code type}
	 * @param type {@link DataType} of the dataset
	 * @throws IllegalArgumentException if {@code type} is not a real type
	 */
	public static double[] asDoubles(final Object data, final DataType type) {

		switch (type) {
		case INT8: {
			final byte[] d = (byte[])data;
			final double[] converted = new double[d.length];
			for (int i = 0; i < d.length; ++i)
				converted[i] = d[i];
			return converted;
		}
		case UINT8: {
			final byte[] d = (byte[])data;
			final double[] converted = new double[d.length];
			for (int i = 0; i < d.length; ++i)
				converted[i] = d[i] & 0xff;
			return converted;
		}
		case INT16: {
			final short[] d = (short[])data;
			final double[] converted = new double[d.length];
			for (int i = 0; i < d.length; ++i)
				converted[i] = d[i];
			return converted;
		}
		case UINT16: {
			final short[] d = (short[])data;
			final double[] converted = new double[d.length];
			for (int i = 0; i < d.length; ++i)
				converted[i] = d[i] & 0xffff;
			return converted;
		}
		case INT32: {
			final int[] d = (int[])data;
			final double[] converted = new double[d.length];
			for (int i = 0; i < d.length; ++i)
				converted[i] = d[i];
			return converted;
		}
		case UINT32: {
			final int[] d = (int[])data;
			final double[] converted = new double[d.length];
			for (int i = 0; i < d.length; ++i)
				converted[i] = d[i] & 0xffffffffL;
			return converted;
		}
		case INT64:
		case UINT64: {
			// UINT64 beyond Long.MAX_VALUE is read as negative and rejected by the schema checks
			final long[] d = (long[])data;
			final double[] converted = new double[d.length];
			for (int i = 0; i < d.length; ++i)
				converted[i] = d[i];
			return converted;
		}
		case FLOAT32: {
			final float[] d = (float[])data;
			final double[] converted = new double[d.length];
			for (int i = 0; i < d.length; ++i)
				converted[i] = d[i];
			return converted;
		}
		case FLOAT64:
			return ((double[])data).clone();
		default:
			throw new IllegalArgumentException("Data type not supported: " + type);
		}
	}
}
