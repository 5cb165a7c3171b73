/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.contentrec.online.generation;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import net.contentrec.common.LangUtils;
import net.contentrec.common.io.IOUtils;
import net.contentrec.online.encoder.IDEncoder;
import net.contentrec.online.factorizer.FactorizationModel;

/**
 * <p>Writes a {@link FactorizationModel} to, and reads it from, three files in a version directory:</p>
 *
 * <ul>
 *   <li>{@code encoders.bin.gz}: user then content IDs, in index order</li>
 *   <li>{@code embeddings.bin}: a header giving user count, item count and feature count, then the user and
 *    content feature matrices row by row, then user and content biases, as big-endian doubles</li>
 *   <li>{@code metadata.json}: the {@link ModelVersion}</li>
 * </ul>
 *
 * <p>All three must be present and agree with each other for the model to be read.</p>
 *
 * @author Sean Owen
 */
public final class ModelSerializer {

  public static final String ENCODERS_FILE = "encoders.bin.gz";
  public static final String EMBEDDINGS_FILE = "embeddings.bin";
  public static final String METADATA_FILE = "metadata.json";

  private static final int ENCODERS_MAGIC = 0x43524945; // "CRIE"
  private static final int EMBEDDINGS_MAGIC = 0x4352454D; // "CREM"
  private static final int FORMAT_VERSION = 1;
  private static final int MAX_ID_BYTES = 1 << 24;

  private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private ModelSerializer() {
  }

  /**
   * @param model trained model to write
   * @param dir existing directory to write into
   * @return description of the written model, whose path is the directory's name
   */
  public static ModelVersion write(FactorizationModel model, File dir) throws IOException {
    Preconditions.checkState(model.isTrained(), "Model is not trained");
    Preconditions.checkArgument(dir.isDirectory(), "Not a directory: %s", dir);
    writeEncoders(model, new File(dir, ENCODERS_FILE));
    writeEmbeddings(model, new File(dir, EMBEDDINGS_FILE));
    ModelVersion version = new ModelVersion(model.getVersionID(),
                                            model.getEmbeddingDim(),
                                            model.getNumUsers(),
                                            model.getNumItems(),
                                            model.getTrainedAt(),
                                            model.getGlobalBias(),
                                            model.getVersionID());
    writeMetadata(version, new File(dir, METADATA_FILE));
    return version;
  }

  /**
   * @param dir directory holding a model's files
   * @return the model
   * @throws ModelArtifactException if a file is missing, malformed or inconsistent with the others
   */
  public static FactorizationModel read(File dir) throws IOException {
    ModelVersion version = readMetadata(dir);
    IDEncoder[] encoders = readEncoders(new File(dir, ENCODERS_FILE));
    IDEncoder userEncoder = encoders[0];
    IDEncoder contentEncoder = encoders[1];
    if (userEncoder.size() != version.getNumUsers() || contentEncoder.size() != version.getNumItems()) {
      throw new ModelArtifactException("Encoders (" + userEncoder.size() + " users, " + contentEncoder.size() +
                                       " items) disagree with metadata in " + dir);
    }

    File embeddingsFile = new File(dir, EMBEDDINGS_FILE);
    checkExists(embeddingsFile);
    DataInputStream in = new DataInputStream(IOUtils.openMaybeDecompressing(embeddingsFile));
    try {
      if (in.readInt() != EMBEDDINGS_MAGIC) {
        throw new ModelArtifactException("Not an embeddings file: " + embeddingsFile);
      }
      checkFormatVersion(in.readInt(), embeddingsFile);
      int numUsers = in.readInt();
      int numItems = in.readInt();
      int dim = in.readInt();
      if (numUsers != version.getNumUsers() || numItems != version.getNumItems() ||
          dim != version.getEmbeddingDim()) {
        throw new ModelArtifactException("Embeddings " + numUsers + 'x' + numItems + 'x' + dim +
                                         " disagree with metadata in " + dir);
      }
      double[][] userEmbeddings = readMatrix(in, numUsers, dim);
      double[][] contentEmbeddings = readMatrix(in, numItems, dim);
      double[] userBiases = readVector(in, numUsers);
      double[] contentBiases = readVector(in, numItems);
      if (in.read() != -1) {
        throw new ModelArtifactException("Unexpected trailing data in " + embeddingsFile);
      }
      return FactorizationModel.restore(version.getVersionID(),
                                        version.getTrainedAt(),
                                        version.getGlobalBias(),
                                        userEncoder,
                                        contentEncoder,
                                        userEmbeddings,
                                        contentEmbeddings,
                                        userBiases,
                                        contentBiases);
    } catch (ModelArtifactException mae) {
      throw mae;
    } catch (EOFException eofe) {
      throw new ModelArtifactException("Truncated " + embeddingsFile, eofe);
    } catch (IOException ioe) {
      throw new ModelArtifactException("Unreadable " + embeddingsFile, ioe);
    } catch (IllegalArgumentException iae) {
      throw new ModelArtifactException("Invalid model in " + dir, iae);
    } finally {
      in.close();
    }
  }

  /**
   * @param dir directory holding a model's files
   * @return the model's description from its metadata document
   * @throws ModelArtifactException if the document is missing or malformed
   */
  public static ModelVersion readMetadata(File dir) throws IOException {
    File metadataFile = new File(dir, METADATA_FILE);
    checkExists(metadataFile);
    try {
      return MAPPER.readValue(metadataFile, ModelVersion.class).withPath(dir.getName());
    } catch (JsonProcessingException jpe) {
      throw new ModelArtifactException("Malformed " + metadataFile, jpe);
    }
  }

  private static void writeMetadata(ModelVersion version, File file) throws IOException {
    MAPPER.writeValue(file, version);
  }

  private static void writeEncoders(FactorizationModel model, File file) throws IOException {
    DataOutputStream out = new DataOutputStream(IOUtils.buildGZIPOutputStream(file));
    try {
      out.writeInt(ENCODERS_MAGIC);
      out.writeInt(FORMAT_VERSION);
      writeIDs(model.getUserEncoder(), out);
      writeIDs(model.getContentEncoder(), out);
    } finally {
      out.close();
    }
  }

  private static void writeIDs(IDEncoder encoder, DataOutputStream out) throws IOException {
    out.writeInt(encoder.size());
    for (String id : encoder.getIDs()) {
      byte[] bytes = id.getBytes(Charsets.UTF_8);
      Preconditions.checkArgument(bytes.length <= MAX_ID_BYTES, "ID too long: %s bytes", bytes.length);
      out.writeInt(bytes.length);
      out.write(bytes);
    }
  }

  /**
   * @return user encoder, then content encoder
   */
  static IDEncoder[] readEncoders(File file) throws IOException {
    checkExists(file);
    DataInputStream in;
    try {
      in = new DataInputStream(IOUtils.openMaybeDecompressing(file));
    } catch (IOException ioe) {
      throw new ModelArtifactException("Unreadable " + file, ioe);
    }
    try {
      if (in.readInt() != ENCODERS_MAGIC) {
        throw new ModelArtifactException("Not an encoders file: " + file);
      }
      checkFormatVersion(in.readInt(), file);
      IDEncoder userEncoder = readIDs(in);
      IDEncoder contentEncoder = readIDs(in);
      return new IDEncoder[] { userEncoder, contentEncoder };
    } catch (ModelArtifactException mae) {
      throw mae;
    } catch (EOFException eofe) {
      throw new ModelArtifactException("Truncated " + file, eofe);
    } catch (IOException ioe) {
      throw new ModelArtifactException("Unreadable " + file, ioe);
    } catch (IllegalArgumentException iae) {
      throw new ModelArtifactException("Invalid encoders in " + file, iae);
    } finally {
      in.close();
    }
  }

  private static IDEncoder readIDs(DataInputStream in) throws IOException {
    int count = in.readInt();
    Preconditions.checkArgument(count >= 0, "Bad ID count: %s", count);
    List<String> ids = Lists.newArrayListWithCapacity(Math.min(count, 1 << 20));
    for (int i = 0; i < count; i++) {
      int length = in.readInt();
      Preconditions.checkArgument(length >= 0 && length <= MAX_ID_BYTES, "Bad ID length: %s", length);
      byte[] bytes = new byte[length];
      in.readFully(bytes);
      ids.add(new String(bytes, Charsets.UTF_8));
    }
    return IDEncoder.fromOrderedIDs(ids);
  }

  private static void writeEmbeddings(FactorizationModel model, File file) throws IOException {
    DataOutputStream out = new DataOutputStream(IOUtils.buildBufferedOutputStream(file));
    try {
      out.writeInt(EMBEDDINGS_MAGIC);
      out.writeInt(FORMAT_VERSION);
      out.writeInt(model.getNumUsers());
      out.writeInt(model.getNumItems());
      out.writeInt(model.getEmbeddingDim());
      writeMatrix(model.getUserEmbeddings(), out);
      writeMatrix(model.getContentEmbeddings(), out);
      writeVector(model.getUserBiases(), out);
      writeVector(model.getContentBiases(), out);
    } finally {
      out.close();
    }
  }

  private static void writeMatrix(double[][] matrix, DataOutputStream out) throws IOException {
    for (double[] row : matrix) {
      writeVector(row, out);
    }
  }

  private static void writeVector(double[] vector, DataOutputStream out) throws IOException {
    for (double d : vector) {
      Preconditions.checkState(LangUtils.isFinite(d), "Bad model value: %s", d);
      out.writeDouble(d);
    }
  }

  private static double[][] readMatrix(DataInputStream in, int rows, int columns) throws IOException {
    double[][] matrix = new double[rows][];
    for (int i = 0; i < rows; i++) {
      matrix[i] = readVector(in, columns);
    }
    return matrix;
  }

  private static double[] readVector(DataInputStream in, int size) throws IOException {
    double[] vector = new double[size];
    for (int i = 0; i < size; i++) {
      double d = in.readDouble();
      if (!LangUtils.isFinite(d)) {
        throw new ModelArtifactException("Bad model value: " + d);
      }
      vector[i] = d;
    }
    return vector;
  }

  private static void checkFormatVersion(int formatVersion, File file) throws ModelArtifactException {
    if (formatVersion != FORMAT_VERSION) {
      throw new ModelArtifactException("Unsupported format version " + formatVersion + " in " + file);
    }
  }

  private static void checkExists(File file) throws ModelArtifactException {
    if (!file.isFile()) {
      throw new ModelArtifactException("Missing " + file);
    }
  }

}
