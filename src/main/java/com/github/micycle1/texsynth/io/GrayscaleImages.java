package com.github.micycle1.texsynth.io;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import javax.imageio.ImageIO;

import org.ejml.data.DMatrixRMaj;

/**
 * Converts between decoded images and the single-channel intensity grids the
 * synthesizer works on. Intensities are in [0,1]; colour is reduced with the
 * ITU-R BT.709 luma weights {@code 0.2125 R + 0.7154 G + 0.0721 B}.
 */
public final class GrayscaleImages {

	public static final double RED_WEIGHT = 0.2125;
	public static final double GREEN_WEIGHT = 0.7154;
	public static final double BLUE_WEIGHT = 0.0721;

	private GrayscaleImages() {
	}

	/**
	 * Decodes {@code file} and reduces it to grayscale.
	 *
	 * @throws IOException if the file cannot be read or no decoder accepts it
	 */
	public static DMatrixRMaj read(Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		BufferedImage img = ImageIO.read(file.toFile());
		if (img == null) {
			throw new IOException("No image decoder for " + file);
		}
		return toGrayscale(img);
	}

	/**
	 * Grayscale grid of {@code img}, rows = image height. Alpha is ignored.
	 * Non-palette images in a gray colour space are read from their raster as is,
	 * without going through the colour model; palette (indexed or binary) and
	 * colour images are reduced from their RGB values.
	 */
	public static DMatrixRMaj toGrayscale(BufferedImage img) {
		final int w = img.getWidth();
		final int h = img.getHeight();
		if (isPlainGray(img)) {
			Raster raster = img.getRaster();
			final double max = (1 << raster.getSampleModel().getSampleSize(0)) - 1;
			DMatrixRMaj grid = new DMatrixRMaj(h, w);
			for (int y = 0; y < h; y++) {
				for (int x = 0; x < w; x++) {
					grid.unsafe_set(y, x, raster.getSample(x, y, 0) / max);
				}
			}
			return grid;
		}
		int[] argb = img.getRGB(0, 0, w, h, null, 0, w);
		DMatrixRMaj grid = new DMatrixRMaj(h, w);
		for (int i = 0; i < argb.length; i++) {
			int rgb = argb[i];
			double r = ((rgb >> 16) & 0xFF) / 255.0;
			double g = ((rgb >> 8) & 0xFF) / 255.0;
			double b = (rgb & 0xFF) / 255.0;
			grid.data[i] = RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b;
		}
		return grid;
	}

	private static boolean isPlainGray(BufferedImage img) {
		ColorModel cm = img.getColorModel();
		return !(cm instanceof IndexColorModel) && cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY
				&& img.getRaster().getNumBands() == 1;
	}

	/**
	 * 8-bit grayscale image of {@code grid}; values are clamped to [0,1] and
	 * rounded to 0..255.
	 */
	public static BufferedImage toImage(DMatrixRMaj grid) {
		BufferedImage img = new BufferedImage(grid.numCols, grid.numRows, BufferedImage.TYPE_BYTE_GRAY);
		WritableRaster raster = img.getRaster();
		for (int y = 0; y < grid.numRows; y++) {
			for (int x = 0; x < grid.numCols; x++) {
				double v = Math.max(0.0, Math.min(1.0, grid.get(y, x)));
				raster.setSample(x, y, 0, (int) Math.round(v * 255.0));
			}
		}
		return img;
	}

	/**
	 * Encodes {@code grid} into {@code file}.
	 *
	 * @param formatName ImageIO format name, e.g. {@code "png"}
	 * @throws IOException if writing fails or no encoder exists for the format
	 */
	public static void write(DMatrixRMaj grid, Path file, String formatName) throws IOException {
		Objects.requireNonNull(grid, "grid must not be null");
		Objects.requireNonNull(file, "file must not be null");
		if (!ImageIO.write(toImage(grid), formatName, file.toFile())) {
			throw new IOException("No image encoder for format '" + formatName + "'");
		}
	}
}
