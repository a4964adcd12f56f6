package utils;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalibrationDatasetTest
{
	@TempDir
	Path dir;
	
	private void write(String name, String content) throws IOException
	{
		Files.write(dir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
	}
	
	@Test
	void sortNatural_ordersByLastNumber()
	{
		List<Path> paths = new ArrayList<Path>(Arrays.asList(
			Paths.get("scan_2_10.png"), Paths.get("scan_2_9.png"), Paths.get("scan_1_100.png"), Paths.get("noindex.png"), Paths.get("scan_2_1.png")));
		CalibrationDataset.sortNatural(paths);
		assertEquals(Arrays.asList(Paths.get("noindex.png"), Paths.get("scan_2_1.png"), Paths.get("scan_2_9.png"), Paths.get("scan_2_10.png"), Paths.get("scan_1_100.png")), paths);
	}
	
	@Test
	void lastNumber_ignoresExtension()
	{
		assertEquals(12L, CalibrationDataset.lastNumber(Paths.get("img3_12.tif")));
		assertEquals(0L, CalibrationDataset.lastNumber(Paths.get("image.tiff")));
	}
	
	@Test
	void splitLine_handlesQuotes()
	{
		assertEquals(Arrays.asList("a", "b,c", "say \"hi\"", ""), CalibrationDataset.splitLine("a,\"b,c\",\"say \"\"hi\"\"\","));
	}
	
	@Test
	void readDisplacements_bomAndPreferredColumn() throws IOException
	{
		String preferred = CalibrationDataset.DISPLACEMENT_COLUMNS[0];
		write("data.csv", "\uFEFFindex,displacement," + preferred + "\n"
		                + "1,9.0,0.0\n"
		                + "2,9.5,\n"
		                + "\n"
		                + "3,n/a,abc\n"
		                + "4,10.0,\"5.5\"\n");
		List<Double> values = CalibrationDataset.readDisplacements(dir.resolve("data.csv"));
		assertEquals(Arrays.asList(0.0, 9.5, 5.5), values);
	}
	
	@Test
	void readDisplacements_unknownHeader_yieldsNothing() throws IOException
	{
		write("data.csv", "a,b\n1,2\n");
		assertTrue(CalibrationDataset.readDisplacements(dir.resolve("data.csv")).isEmpty());
	}
	
	@Test
	void open_pairsImagesWithRows() throws IOException
	{
		write("b.csv", "displacement\n99\n");
		write("a.csv", "displacement\n0\n5\n10\n");
		write("depth_10.png", "");
		write("depth_2.png", "");
		write("depth_1.tif", "");
		write("notes.txt", "");
		
		CalibrationDataset dataset = CalibrationDataset.open(dir);
		assertEquals(dir.resolve("a.csv"), dataset.csv_path);
		assertEquals(3, dataset.size());
		assertEquals(dir.resolve("depth_1.tif"), dataset.image(0));
		assertEquals(dir.resolve("depth_10.png"), dataset.image(2));
		assertEquals(10.0, dataset.displacement(2), 0.0);
	}
	
	@Test
	void open_sizeIsShorterSide() throws IOException
	{
		write("a.csv", "displacement\n0\n5\n10\n");
		write("depth_1.png", "");
		assertEquals(1, CalibrationDataset.open(dir).size());
	}
	
	@Test
	void open_missingCsvOrDirectory()
	{
		assertThrows(FileNotFoundException.class, () -> CalibrationDataset.open(dir));
		assertThrows(FileNotFoundException.class, () -> CalibrationDataset.open(dir.resolve("absent")));
	}
	
	@Test
	void listImages_missingDirectory_isEmpty() throws IOException
	{
		assertTrue(CalibrationDataset.listImages(dir.resolve("absent")).isEmpty());
	}
}
