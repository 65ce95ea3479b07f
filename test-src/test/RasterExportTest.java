package test;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.gdal.gdal.Dataset;
import org.gdal.gdal.gdal;
import org.gdal.gdalconst.gdalconst;
import org.junit.Before;
import org.junit.Test;

import rill.Key;
import rill.raster.RasterExport;
import rill.raster.TiffBand;
import rill.store.DatasetNotFoundException;
import rill.store.ElementType;
import rill.store.IceStore;
import rill.store.SizeMismatchException;
import rill.util.Bits;

public class RasterExportTest extends TestUtil {
  static final double[] GEO = { -50.0, 0.25, 0, -10.0, 0, -0.25 };

  @Before public void gdal() { assumeGdal(); }

  static IceStore stats( IceStore s, String g, int w, int h ) throws Exception {
    int n = w*h;
    int[] count = new int[n];
    for( int i=0; i<n; i++ ) count[i] = i%7;
    float[] mean = rowsOf(h,w), sd = new float[n];
    for( int i=0; i<n; i++ ) sd[i] = count[i] == 0 ? -1f : i*0.5f;
    putCounts(s,g+"/count_rev",count);
    putFloats(s,g+"/mean_rev",mean);
    putFloats(s,g+"/sd_rev",sd);
    return s;
  }

  // A georeferenced template raster, as a GIS would hand it over
  static File template( File f, int w, int h, int gdalType ) {
    Dataset ds = gdal.GetDriverByName("GTiff").Create(f.getPath(),w,h,1,gdalType);
    ds.SetGeoTransform(GEO);
    ds.GetRasterBand(1).Fill(3);
    ds.delete();
    return f;
  }

  @Test public void testExport() throws Exception {
    final int w = 6, h = 7;
    IceStore s = stats(store(),"/cerrado/g1",w,h);
    File dir = new File(_tmp.getRoot(),"rasters");
    RasterExport ex = new RasterExport(s,dir,"100_cerrado",w,h,3); // Lines do not divide the height
    List<File> files = ex.export(Key.make("/cerrado/g1"));
    assertEquals(3, files.size());
    assertEquals(new File(dir,"100_cerrado_cerradog1_count.tif"), files.get(0));
    assertEquals(new File(dir,"100_cerrado_cerradog1_mean.tif"), files.get(1));
    assertEquals(new File(dir,"100_cerrado_cerradog1_sd.tif"), files.get(2));

    TiffBand t = TiffBand.open(files.get(0),false);
    try {
      assertEquals(ElementType.U8, t._type);
      assertArrayEquals(get(s,"/cerrado/g1/count_rev"), t.read(0,0,w,h));
    } finally {
      t.close();
    }
    t = TiffBand.open(files.get(2),false);
    try {
      assertEquals(ElementType.F32, t._type);
      assertFloats(getFloats(s,"/cerrado/g1/sd_rev"), Bits.toFloats(t.read(0,0,w,h)));
    } finally {
      t.close();
    }
  }

  // Outputs are template copies: pixels replaced, georeferencing kept
  @Test public void testTemplatesCarryGeoreferencing() throws Exception {
    final int w = 4, h = 5;
    IceStore s = stats(store(),"/g",w,h);
    File bytes = template(_tmp.newFile("base_byte.tif"),w,h,gdalconst.GDT_Byte);
    File floats = template(_tmp.newFile("base_float.tif"),w,h,gdalconst.GDT_Float32);
    File dir = _tmp.newFolder();
    List<File> files = new RasterExport(s,dir,"p",w,h,2).templates(bytes,floats).export(Key.make("/g"));
    for( File f : files ) {
      Dataset ds = gdal.Open(f.getPath());
      try {
        assertArrayEquals(f.getName(), GEO, ds.GetGeoTransform(), 0);
      } finally {
        ds.delete();
      }
    }
    TiffBand t = TiffBand.open(files.get(1),false);
    try {
      assertFloats(getFloats(s,"/g/mean_rev"), Bits.toFloats(t.read(0,0,w,h)));
    } finally {
      t.close();
    }
    // The templates themselves are untouched
    t = TiffBand.open(bytes,false);
    try {
      assertArrayEquals(new byte[]{ 3,3,3,3 }, t.read(0,0,w,1));
    } finally {
      t.close();
    }
  }

  @Test public void testTemplateOfTheWrongType() throws Exception {
    IceStore s = stats(store(),"/g",2,2);
    File floats = template(_tmp.newFile("f.tif"),2,2,gdalconst.GDT_Float32);
    try {
      new RasterExport(s,_tmp.newFolder(),"p",2,2,100).templates(floats,floats).export(Key.make("/g"));
      fail("a float template took the counts");
    } catch( IOException e ) {
      assertTrue(e.getMessage(), e.getMessage().contains("template"));
    }
  }

  @Test public void testOverwrites() throws Exception {
    IceStore s = stats(store(),"/g",2,2);
    File dir = _tmp.newFolder();
    RasterExport ex = new RasterExport(s,dir,"p",2,2,100);
    File f = ex.export(Key.make("/g")).get(1);
    TiffBand t = TiffBand.open(f,true);
    t.write(0,0,2,2,new byte[16]);
    t.close();
    ex.export(Key.make("/g"));
    t = TiffBand.open(f,false);
    try {
      assertFloats(new float[]{ 1,2,3,4 }, Bits.toFloats(t.read(0,0,2,2)));
    } finally {
      t.close();
    }
  }

  @Test public void testWrongSize() throws Exception {
    IceStore s = stats(store(),"/g",3,3);
    try {
      new RasterExport(s,_tmp.newFolder(),"p",3,4,100).export(Key.make("/g"));
      fail("expected a size mismatch");
    } catch( SizeMismatchException e ) {
      assertEquals(Key.make("/g/count_rev"), e._key);
      assertEquals(12, e._expected);
    }
  }

  @Test(expected = DatasetNotFoundException.class)
  public void testNothingToExport() throws Exception {
    IceStore s = store();
    putFloats(s,"/g/sum", 1);
    new RasterExport(s,_tmp.newFolder(),"p",1,1,100).export(Key.make("/g"));
  }
}
